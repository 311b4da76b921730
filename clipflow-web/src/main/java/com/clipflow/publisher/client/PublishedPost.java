package com.clipflow.publisher.client;

public record PublishedPost(String remotePostId, String postUrl) {
}
