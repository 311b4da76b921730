package com.clipflow.publisher.dto;

/**
 * Token to use for a platform call. When {@code error} is set the token may be stale or absent.
 */
public record ValidToken(String accessToken, String accountId, String error) {

    public boolean hasToken() {
        return accessToken != null && !accessToken.isBlank();
    }

    public boolean isVerified() {
        return hasToken() && error == null;
    }
}
