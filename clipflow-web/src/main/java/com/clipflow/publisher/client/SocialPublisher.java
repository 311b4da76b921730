package com.clipflow.publisher.client;

import com.clipflow.publisher.model.Platform;

public interface SocialPublisher {

    Platform platform();

    /**
     * Publishes the media with its caption. Throws {@link com.clipflow.publisher.exception.CredentialException}
     * when the platform rejects the token.
     */
    PublishedPost publish(PublishRequest request);
}
