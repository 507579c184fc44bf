package com.whereq.modelhub.pipeline;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Options for one pipeline execution
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionOptions {
    /**
     * Snapshot every step's output into the execution results
     */
    private boolean includeIntermediateResults;

    /**
     * Free-form values handed to user-supplied step functions
     */
    private Map<String, Object> context;

    public static ExecutionOptions defaults() {
        return ExecutionOptions.builder().build();
    }
}
