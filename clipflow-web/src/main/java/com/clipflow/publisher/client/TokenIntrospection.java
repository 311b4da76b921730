package com.clipflow.publisher.client;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Remote verdict on an access token. {@code expiresAt} is null for tokens that never expire.
 */
public record TokenIntrospection(boolean valid, LocalDateTime expiresAt, List<String> scopes, String error) {

    public TokenIntrospection {
        scopes = scopes == null ? List.of() : List.copyOf(scopes);
    }
}
