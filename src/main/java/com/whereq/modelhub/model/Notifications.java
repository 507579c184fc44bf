package com.whereq.modelhub.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Webhook notification settings for a training job
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Notifications {
    /**
     * Webhook URL to POST the terminal job state to
     */
    private String webhook;

    /**
     * Notify when training completes
     */
    @Builder.Default
    private boolean onSuccess = true;

    /**
     * Notify when training fails
     */
    @Builder.Default
    private boolean onFailure = true;

    public boolean shouldNotify(TrainingJobStatus status) {
        return switch (status) {
            case COMPLETED -> onSuccess;
            case FAILED -> onFailure;
            default -> false;
        };
    }
}
