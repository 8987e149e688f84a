package com.paperless.common.message;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Outcome of a {@link GenAICommand}.
 * Success carries a summary, failure carries an error message, never both.
 */
public record GenAIEvent(
        UUID documentId,
        String summary,
        OffsetDateTime generatedAt,
        String errorMessage
) {
    public static GenAIEvent success(UUID documentId, String summary) {
        return new GenAIEvent(documentId, summary, OffsetDateTime.now(), null);
    }

    public static GenAIEvent failure(UUID documentId, String errorMessage) {
        return new GenAIEvent(documentId, null, OffsetDateTime.now(), errorMessage);
    }

    @JsonIgnore
    public boolean isSuccessful() {
        return summary != null && !summary.isEmpty();
    }
}
