package com.clipflow.publisher.service;

import com.clipflow.publisher.client.CaptionGenerationClient;
import com.clipflow.publisher.client.CaptionStyle;
import com.clipflow.publisher.exception.InvalidStateException;
import com.clipflow.publisher.exception.RemoteRejectionException;
import com.clipflow.publisher.model.CaptionSettings;
import com.clipflow.publisher.model.Platform;
import com.clipflow.publisher.model.PlatformCaption;
import com.clipflow.publisher.model.Video;
import com.clipflow.publisher.util.AppConstants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
public class CaptionService {

    private final CaptionGenerationClient captionClient;
    private final CaptionSettingsService settingsService;
    private final RetryExecutor retryExecutor;
    private final int maxAttempts;
    private final Duration baseDelay;

    public CaptionService(CaptionGenerationClient captionClient,
                          CaptionSettingsService settingsService,
                          RetryExecutor retryExecutor,
                          @Value("${app.captions.retry.max-attempts:3}") int maxAttempts,
                          @Value("${app.captions.retry.base-delay:2s}") Duration baseDelay) {
        this.captionClient = captionClient;
        this.settingsService = settingsService;
        this.retryExecutor = retryExecutor;
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
    }

    /** Captions for every platform, each within its platform's limit. */
    public Map<Platform, PlatformCaption> generate(Video video) {
        if (!video.hasTranscript()) {
            throw new InvalidStateException("Video " + video.getId() + " has no transcript");
        }
        CaptionSettings settings = settingsService.current();
        CaptionStyle style = settingsService.toStyle(settings);

        Map<Platform, PlatformCaption> generated = retryExecutor.execute(
                () -> captionClient.generate(video.getTranscript(), video.getTitle(), style),
                maxAttempts, baseDelay, RetryExecutor::isRetryable);

        Map<Platform, PlatformCaption> captions = new EnumMap<>(Platform.class);
        for (Platform platform : Platform.values()) {
            PlatformCaption raw = generated.get(platform);
            if (raw == null) {
                throw new RemoteRejectionException(AppConstants.SERVICE_OPENAI, 0, "No caption generated for " + platform.key());
            }
            captions.put(platform, fit(platform, raw.caption(), raw.hashtags(), settings.hashtagCountFor(platform), settings));
        }
        log.info("Generated captions for video {}", video.getId());
        return captions;
    }

    /** A caption edited by hand. Its hashtags are kept as given, the length limit still applies. */
    public PlatformCaption revise(Platform platform, String caption, List<String> hashtags) {
        return fit(platform, caption, hashtags, Integer.MAX_VALUE, settingsService.current());
    }

    private PlatformCaption fit(Platform platform, String caption, List<String> hashtags, int hashtagLimit,
                                CaptionSettings settings) {
        List<String> tags = hashtags == null ? List.of() : hashtags.stream().limit(hashtagLimit).toList();
        PlatformCaption fitted = CaptionTruncator.fit(caption, tags, platform.getMaxCaptionLength(), settings.resolvedCallToAction());
        if (fitted.charCount() < PlatformCaption.countCharacters(caption, tags)) {
            log.debug("Shortened {} caption to {} characters", platform, fitted.charCount());
        }
        return fitted;
    }
}
