package com.clipflow.publisher.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDateTime;

/**
 * Result of one publish attempt for one platform. Only the fields relevant to the status are set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PublishOutcome(
        Status status,
        String postId,
        String postUrl,
        LocalDateTime publishedAt,
        String error,
        LocalDateTime failedAt,
        String reason,
        LocalDateTime skippedAt) {

    public enum Status {
        POSTED,
        FAILED,
        SKIPPED
    }

    public static PublishOutcome posted(String postId, String postUrl, LocalDateTime publishedAt) {
        return new PublishOutcome(Status.POSTED, postId, postUrl, publishedAt, null, null, null, null);
    }

    public static PublishOutcome failed(String error, LocalDateTime failedAt) {
        return new PublishOutcome(Status.FAILED, null, null, null, error, failedAt, null, null);
    }

    public static PublishOutcome skipped(String reason, LocalDateTime skippedAt) {
        return new PublishOutcome(Status.SKIPPED, null, null, null, null, null, reason, skippedAt);
    }

    @JsonIgnore
    public boolean isPosted() {
        return status == Status.POSTED;
    }

    @JsonIgnore
    public boolean isFailed() {
        return status == Status.FAILED;
    }
}
