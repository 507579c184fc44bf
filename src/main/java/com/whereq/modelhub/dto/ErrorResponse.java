package com.whereq.modelhub.dto;

import com.whereq.modelhub.exception.ErrorKind;
import com.whereq.modelhub.exception.ModelHubException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Error rendering for the service boundary: kind and message only
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {
    private ErrorKind kind;

    private String message;

    private Instant timestamp;

    /**
     * Create error response
     */
    public static ErrorResponse from(Throwable error) {
        if (error instanceof ModelHubException) {
            ModelHubException hubError = (ModelHubException) error;
            return ErrorResponse.builder()
                .kind(hubError.getErrorKind())
                .message(hubError.getMessage())
                .timestamp(Instant.now())
                .build();
        }
        return ErrorResponse.builder()
            .kind(ErrorKind.INTERNAL)
            .message("Internal error: " + error.getClass().getSimpleName())
            .timestamp(Instant.now())
            .build();
    }
}
