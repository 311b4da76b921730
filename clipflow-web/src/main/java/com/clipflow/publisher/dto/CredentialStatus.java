package com.clipflow.publisher.dto;

import com.clipflow.publisher.model.Platform;

import java.time.LocalDateTime;
import java.util.List;

public record CredentialStatus(
        Platform platform,
        boolean hasToken,
        boolean valid,
        CredentialState state,
        LocalDateTime expiresAt,
        boolean expiringSoon,
        List<String> scopes,
        String accountName,
        LocalDateTime lastRefreshedAt,
        String error) {
}
