package com.clipflow.publisher.dto;

import java.time.LocalDateTime;
import java.util.List;

public record TokenValidation(boolean valid, CredentialState state, LocalDateTime expiresAt, List<String> scopes, String error) {

    public static TokenValidation absent() {
        return new TokenValidation(false, CredentialState.ABSENT, null, List.of(), "No access token configured");
    }

    public static TokenValidation expired(LocalDateTime expiresAt) {
        return new TokenValidation(false, CredentialState.EXPIRED, expiresAt, List.of(), "Token has expired");
    }

    public static TokenValidation invalid(LocalDateTime expiresAt, String error) {
        return new TokenValidation(false, CredentialState.INVALID, expiresAt, List.of(),
                error != null ? error : "Token is not valid");
    }
}
