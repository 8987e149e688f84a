package com.paperless.common.message;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Outcome of an {@link OcrCommand}. {@code text} is only populated when the job completed.
 */
public record OcrEvent(
        UUID jobId,
        OcrStatus status,
        String text,
        OffsetDateTime processedAt
) {
    public static OcrEvent completed(UUID jobId, String text) {
        return new OcrEvent(jobId, OcrStatus.COMPLETED, text, OffsetDateTime.now());
    }

    public static OcrEvent failed(UUID jobId) {
        return new OcrEvent(jobId, OcrStatus.FAILED, null, OffsetDateTime.now());
    }

    @JsonIgnore
    public boolean isCompleted() {
        return status == OcrStatus.COMPLETED;
    }
}
