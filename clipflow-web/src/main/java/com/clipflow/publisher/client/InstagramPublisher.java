package com.clipflow.publisher.client;

import com.clipflow.publisher.exception.PipelineException;
import com.clipflow.publisher.exception.RemoteRejectionException;
import com.clipflow.publisher.exception.RemoteTransientException;
import com.clipflow.publisher.model.Platform;
import com.clipflow.publisher.util.AppConstants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Publishes Reels: a media container is created, polled until Instagram has processed the video,
 * then published.
 */
@Slf4j
@Component
public class InstagramPublisher implements SocialPublisher {

    private static final String FINISHED = "FINISHED";

    private final FacebookGraphClient graphClient;
    private final Duration pollInterval;
    private final int maxPolls;

    public InstagramPublisher(FacebookGraphClient graphClient,
                              @Value("${app.instagram.container-poll-interval:5s}") Duration pollInterval,
                              @Value("${app.instagram.container-max-polls:60}") int maxPolls) {
        this.graphClient = graphClient;
        this.pollInterval = pollInterval;
        this.maxPolls = maxPolls;
    }

    @Override
    public Platform platform() {
        return Platform.INSTAGRAM;
    }

    @Override
    public PublishedPost publish(PublishRequest request) {
        String containerId = graphClient.createReelContainer(
                request.accountId(), request.mediaUrl(), request.caption(), request.accessToken());
        awaitContainer(containerId, request.accessToken());

        String mediaId = graphClient.publishContainer(request.accountId(), containerId, request.accessToken());
        String url = graphClient.permalink(mediaId, request.accessToken())
                .orElse("https://www.instagram.com/p/" + mediaId);
        log.info("Published reel {} to Instagram account {}", mediaId, request.accountId());
        return new PublishedPost(mediaId, url);
    }

    private void awaitContainer(String containerId, String accessToken) {
        for (int poll = 1; poll <= maxPolls; poll++) {
            String status = graphClient.containerStatus(containerId, accessToken);
            if (FINISHED.equals(status)) {
                return;
            }
            if ("ERROR".equals(status) || "EXPIRED".equals(status)) {
                throw new RemoteRejectionException(AppConstants.SERVICE_FACEBOOK, 0,
                        "Instagram could not process the video (container status " + status + ")");
            }
            log.debug("Reel container {} is {} (poll {}/{})", containerId, status, poll, maxPolls);
            sleep();
        }
        throw new RemoteTransientException(AppConstants.SERVICE_FACEBOOK, 0,
                "Instagram did not finish processing the video in time");
    }

    private void sleep() {
        try {
            Thread.sleep(pollInterval.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PipelineException("Interrupted while waiting for Instagram", e);
        }
    }
}
