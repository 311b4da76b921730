package com.clipflow.publisher.client;

/**
 * Token returned by an exchange. {@code expiresInSeconds} is 0 when the service did not say.
 */
public record ExchangedToken(String accessToken, long expiresInSeconds) {
}
