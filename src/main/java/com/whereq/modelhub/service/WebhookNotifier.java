package com.whereq.modelhub.service;

import com.whereq.modelhub.model.TrainingJob;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Service for sending training webhook notifications
 */
@Slf4j
@Service
public class WebhookNotifier {

    @Autowired
    private WebClient.Builder webClientBuilder;

    private static final Duration WEBHOOK_TIMEOUT = Duration.ofSeconds(10);

    /**
     * Notify webhook about a training job reaching a terminal state
     *
     * @param webhookUrl webhook URL
     * @param job job snapshot
     * @return Mono that completes when notification sent
     */
    public Mono<Void> notify(String webhookUrl, TrainingJob job) {
        if (webhookUrl == null || webhookUrl.isEmpty()) {
            return Mono.empty();
        }

        Map<String, Object> payload = buildPayload(job);

        return webClientBuilder.build()
            .post()
            .uri(webhookUrl)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(payload)
            .retrieve()
            .toBodilessEntity()
            .timeout(WEBHOOK_TIMEOUT)
            .doOnSuccess(response -> log.info("Webhook notification sent for job {}: {} - {}",
                job.getJobId(), job.getStatus(), response.getStatusCode()))
            .doOnError(error -> log.error("Failed to send webhook notification for job {}: {}",
                job.getJobId(), error.getMessage()))
            .onErrorResume(e -> Mono.empty()) // Don't fail job if webhook fails
            .then();
    }

    private Map<String, Object> buildPayload(TrainingJob job) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("jobId", job.getJobId());
        payload.put("modelId", job.getModelId());
        payload.put("status", job.getStatus().name());
        payload.put("progress", job.getProgress());
        payload.put("startTime", String.valueOf(job.getStartTime()));
        payload.put("endTime", String.valueOf(job.getEndTime()));

        if (job.getErrorMessage() != null) {
            payload.put("error", job.getErrorMessage());
        }
        if (job.getResult() != null) {
            payload.put("result", job.getResult());
        }

        return payload;
    }
}
