package com.clipflow.publisher.client;

public record ManagedPage(String id, String name, String accessToken) {
}
