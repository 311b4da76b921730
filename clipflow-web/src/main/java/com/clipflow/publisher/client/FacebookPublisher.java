package com.clipflow.publisher.client;

import com.clipflow.publisher.model.Platform;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class FacebookPublisher implements SocialPublisher {

    private final FacebookGraphClient graphClient;

    @Override
    public Platform platform() {
        return Platform.FACEBOOK;
    }

    @Override
    public PublishedPost publish(PublishRequest request) {
        String videoId = graphClient.publishPageVideo(
                request.accountId(), request.mediaUrl(), request.caption(), request.accessToken());
        log.info("Published video {} to Facebook page {}", videoId, request.accountId());
        return new PublishedPost(videoId, "https://www.facebook.com/" + request.accountId() + "/videos/" + videoId);
    }
}
