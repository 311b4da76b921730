package com.clipflow.publisher.client;

public record PublishRequest(String accountId, String mediaUrl, String caption, String accessToken) {
}
