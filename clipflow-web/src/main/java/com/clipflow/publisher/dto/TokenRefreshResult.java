package com.clipflow.publisher.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.LocalDateTime;

public record TokenRefreshResult(boolean success, @JsonIgnore String accessToken, LocalDateTime expiresAt,
                                 FailureReason reason, String error) {

    public enum FailureReason {
        MISSING_CONFIG,
        REMOTE_REJECTED,
        NETWORK_FAILURE,
        CONFLICT
    }

    public static TokenRefreshResult refreshed(String accessToken, LocalDateTime expiresAt) {
        return new TokenRefreshResult(true, accessToken, expiresAt, null, null);
    }

    public static TokenRefreshResult failed(FailureReason reason, String error) {
        return new TokenRefreshResult(false, null, null, reason, error);
    }
}
