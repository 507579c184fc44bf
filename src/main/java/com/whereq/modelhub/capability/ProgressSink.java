package com.whereq.modelhub.capability;

import java.util.Map;

/**
 * Receives progress reports from a running training capability
 */
@FunctionalInterface
public interface ProgressSink {

    /**
     * @param percentComplete 0 to 100
     * @param metrics metrics observed at this point (loss, error, ...)
     */
    void onProgress(double percentComplete, Map<String, Double> metrics);

    static ProgressSink noop() {
        return (percent, metrics) -> { };
    }
}
