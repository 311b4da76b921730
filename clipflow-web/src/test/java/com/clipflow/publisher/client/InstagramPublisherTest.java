package com.clipflow.publisher.client;

import com.clipflow.publisher.exception.RemoteRejectionException;
import com.clipflow.publisher.exception.RemoteTransientException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class InstagramPublisherTest {

    private static final PublishRequest REQUEST =
            new PublishRequest("ig-1", "https://cdn.example.com/reel.mp4", "caption #tag", "token");

    @Mock
    private FacebookGraphClient graphClient;

    private InstagramPublisher publisher;

    @BeforeEach
    void setUp() {
        publisher = new InstagramPublisher(graphClient, Duration.ZERO, 3);
        when(graphClient.createReelContainer("ig-1", "https://cdn.example.com/reel.mp4", "caption #tag", "token"))
                .thenReturn("container-1");
    }

    @Test
    void publish_shouldWaitForContainerThenPublish() {
        when(graphClient.containerStatus("container-1", "token")).thenReturn("IN_PROGRESS", "FINISHED");
        when(graphClient.publishContainer("ig-1", "container-1", "token")).thenReturn("media-9");
        when(graphClient.permalink("media-9", "token")).thenReturn(Optional.of("https://www.instagram.com/reel/abc/"));

        PublishedPost post = publisher.publish(REQUEST);

        assertEquals("media-9", post.remotePostId());
        assertEquals("https://www.instagram.com/reel/abc/", post.postUrl());
        verify(graphClient, times(2)).containerStatus("container-1", "token");
    }

    @Test
    void publish_shouldFallBackToConstructedUrl() {
        when(graphClient.containerStatus("container-1", "token")).thenReturn("FINISHED");
        when(graphClient.publishContainer("ig-1", "container-1", "token")).thenReturn("media-9");
        when(graphClient.permalink("media-9", "token")).thenReturn(Optional.empty());

        assertEquals("https://www.instagram.com/p/media-9", publisher.publish(REQUEST).postUrl());
    }

    @Test
    void publish_shouldRejectFailedContainer() {
        when(graphClient.containerStatus("container-1", "token")).thenReturn("ERROR");

        assertThrows(RemoteRejectionException.class, () -> publisher.publish(REQUEST));
        verify(graphClient, never()).publishContainer(any(), any(), any());
    }

    @Test
    void publish_shouldTimeOutAsTransientFailure() {
        when(graphClient.containerStatus("container-1", "token")).thenReturn("IN_PROGRESS");

        RemoteTransientException error = assertThrows(RemoteTransientException.class, () -> publisher.publish(REQUEST));

        assertTrue(error.isRetryable());
        verify(graphClient, times(3)).containerStatus("container-1", "token");
    }
}
