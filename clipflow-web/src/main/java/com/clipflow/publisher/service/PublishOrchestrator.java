package com.clipflow.publisher.service;

import com.clipflow.publisher.client.PublishRequest;
import com.clipflow.publisher.client.PublishedPost;
import com.clipflow.publisher.client.SocialPublisher;
import com.clipflow.publisher.dto.PublishPlan;
import com.clipflow.publisher.dto.TokenRefreshResult;
import com.clipflow.publisher.dto.ValidToken;
import com.clipflow.publisher.exception.CredentialException;
import com.clipflow.publisher.exception.InvalidStateException;
import com.clipflow.publisher.exception.NoCredentialsException;
import com.clipflow.publisher.exception.PersistenceException;
import com.clipflow.publisher.exception.ResourceNotFoundException;
import com.clipflow.publisher.exception.ValidationException;
import com.clipflow.publisher.model.Platform;
import com.clipflow.publisher.model.Post;
import com.clipflow.publisher.model.PublishOutcome;
import com.clipflow.publisher.model.Video;
import com.clipflow.publisher.model.VideoStatus;
import com.clipflow.publisher.repository.PostRepository;
import com.clipflow.publisher.repository.VideoRepository;
import com.clipflow.publisher.util.AppConstants;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Publishes one video to its selected platforms. Platforms are attempted one after another and a
 * failure on one never stops the others; the video ends POSTED when at least one platform
 * succeeded.
 */
@Service
public class PublishOrchestrator {
    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(PublishOrchestrator.class);

    // A publish rejected for its token gets one refresh and one more try
    private enum RecoveryBudget {
        FRESH,
        AFTER_REFRESH
    }

    private final VideoRepository videoRepository;
    private final PostRepository postRepository;
    private final CredentialManagerRegistry credentials;
    private final Map<Platform, SocialPublisher> publishers = new EnumMap<>(Platform.class);
    private final RetryExecutor retryExecutor;
    private final PipelineTaskService taskService;
    private final Clock clock;
    private final int maxAttempts;
    private final Duration baseDelay;

    public PublishOrchestrator(VideoRepository videoRepository,
                               PostRepository postRepository,
                               CredentialManagerRegistry credentials,
                               List<SocialPublisher> publishers,
                               RetryExecutor retryExecutor,
                               PipelineTaskService taskService,
                               Clock clock,
                               @Value("${app.publish.retry.max-attempts:3}") int maxAttempts,
                               @Value("${app.publish.retry.base-delay:2s}") Duration baseDelay) {
        this.videoRepository = videoRepository;
        this.postRepository = postRepository;
        this.credentials = credentials;
        publishers.forEach(publisher -> this.publishers.put(publisher.platform(), publisher));
        this.retryExecutor = retryExecutor;
        this.taskService = taskService;
        this.clock = clock;
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
    }

    /**
     * Checks a publish request before the video changes state. Throws when nothing could be
     * published; the video is left untouched in that case.
     */
    public PublishPlan preparePublish(Video video, Collection<Platform> platforms) {
        if (platforms == null || platforms.isEmpty()) {
            throw new ValidationException("At least one platform must be selected");
        }
        if (video.getFileUrl() == null || video.getFileUrl().isBlank()) {
            throw new ValidationException("Video " + video.getId() + " has no media URL");
        }
        if (!video.hasCaptionForAny(platforms)) {
            throw new InvalidStateException("Video " + video.getId() + " has no captions for the selected platforms");
        }
        PublishPlan plan = partition(platforms);
        if (plan.available().isEmpty()) {
            throw new NoCredentialsException(plan.skipped());
        }
        return plan;
    }

    public PublishPlan partition(Collection<Platform> platforms) {
        List<Platform> available = new ArrayList<>();
        List<Platform> skipped = new ArrayList<>();
        for (Platform platform : new LinkedHashSet<>(platforms)) {
            if (credentials.forPlatform(platform).hasUsableCredential()) {
                available.add(platform);
            } else {
                skipped.add(platform);
            }
        }
        return new PublishPlan(available, skipped);
    }

    /**
     * Background half of a publish. Runs only while the video is PUBLISHING, so a repeated job
     * is harmless; platforms that already produced a post during this attempt are not published
     * again.
     */
    public void executePublish(Long videoId) {
        Video video = videoRepository.findById(videoId).orElseThrow(() -> ResourceNotFoundException.video(videoId));
        if (video.getStatus() != VideoStatus.PUBLISHING) {
            log.info("Video {} is {}, not publishing", videoId, video.getStatus());
            return;
        }

        Map<Platform, PublishOutcome> outcomes = new EnumMap<>(Platform.class);
        PersistenceException persistenceFailure = null;
        try {
            PublishPlan plan = partition(video.getSelectedPlatforms());
            log.info("Publishing video {} to {} (skipping {})", videoId, plan.available(), plan.skipped());
            for (Platform platform : plan.available()) {
                publishPlatform(video, platform, outcomes);
                recordProgress(video, outcomes);
            }
            LocalDateTime now = LocalDateTime.now(clock);
            for (Platform platform : plan.skipped()) {
                outcomes.put(platform, PublishOutcome.skipped(AppConstants.NO_CREDENTIALS_REASON, now));
            }
        } catch (PersistenceException e) {
            log.error("Could not record publish results for video {}", videoId, e);
            persistenceFailure = e;
        } catch (RuntimeException e) {
            log.error("Publishing video {} was interrupted", videoId, e);
        } finally {
            finishPublish(video, outcomes, persistenceFailure);
        }

        if (outcomes.values().stream().anyMatch(PublishOutcome::isPosted)) {
            taskService.scheduleAnalyticsRefresh(videoId);
        }
    }

    private void publishPlatform(Video video, Platform platform, Map<Platform, PublishOutcome> outcomes) {
        Optional<Post> existing = video.getPublishStartedAt() == null
                ? Optional.empty()
                : postRepository.findFirstByVideoIdAndPlatformAndCreatedAtGreaterThanEqual(
                        video.getId(), platform, video.getPublishStartedAt());
        if (existing.isPresent()) {
            Post post = existing.get();
            log.info("Video {} already posted to {} as {}", video.getId(), platform, post.getRemotePostId());
            outcomes.put(platform, PublishOutcome.posted(post.getRemotePostId(), post.getPostUrl(), post.getPublishedAt()));
            return;
        }

        String caption = video.captionFor(platform);
        PublishedPost published;
        try {
            if (caption == null) {
                throw new ValidationException("No caption for " + platform.getDisplayName());
            }
            published = publishWithRecovery(video, platform, caption);
        } catch (RuntimeException e) {
            log.error("Failed to publish video {} to {}", video.getId(), platform, e);
            outcomes.put(platform, PublishOutcome.failed(e.getMessage(), LocalDateTime.now(clock)));
            return;
        }

        LocalDateTime publishedAt = LocalDateTime.now(clock);
        outcomes.put(platform, PublishOutcome.posted(published.remotePostId(), published.postUrl(), publishedAt));
        log.info("Published video {} to {}: {}", video.getId(), platform, published.postUrl());
        try {
            postRepository.save(new Post(video.getId(), platform, published.remotePostId(),
                    published.postUrl(), caption, publishedAt));
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to record " + platform.getDisplayName() + " post "
                    + published.remotePostId() + " for video " + video.getId(), e);
        }
    }

    private PublishedPost publishWithRecovery(Video video, Platform platform, String caption) {
        SocialPublisher publisher = publishers.get(platform);
        if (publisher == null) {
            throw new ValidationException("Publishing to " + platform.getDisplayName() + " is not supported yet");
        }
        CredentialLifecycleManager manager = credentials.forPlatform(platform);
        if (manager.needsProactiveRefresh()) {
            TokenRefreshResult refreshed = manager.refresh();
            if (!refreshed.success()) {
                log.warn("Proactive {} token refresh failed: {}", platform, refreshed.error());
            }
        }

        ValidToken token = manager.requireToken();
        if (token.error() != null) {
            log.warn("Publishing to {} with an unverified token: {}", platform, token.error());
        }

        String accessToken = token.accessToken();
        RecoveryBudget budget = RecoveryBudget.FRESH;
        while (true) {
            PublishRequest request = new PublishRequest(token.accountId(), video.getFileUrl(), caption, accessToken);
            try {
                return retryExecutor.execute(() -> publisher.publish(request), maxAttempts, baseDelay, RetryExecutor::isRetryable);
            } catch (CredentialException e) {
                if (budget == RecoveryBudget.AFTER_REFRESH) {
                    throw e;
                }
                budget = RecoveryBudget.AFTER_REFRESH;
                log.warn("{} rejected the token for video {}, refreshing once: {}", platform, video.getId(), e.getMessage());
                TokenRefreshResult refreshed = manager.refresh();
                if (!refreshed.success()) {
                    throw new CredentialException(platform,
                            e.getMessage() + " (token refresh failed: " + refreshed.error() + ")", e);
                }
                accessToken = refreshed.accessToken();
            }
        }
    }

    // Each save moves updatedAt, which keeps a running publish out of stalled-video recovery
    private void recordProgress(Video video, Map<Platform, PublishOutcome> outcomes) {
        video.setPublishedPlatforms(new LinkedHashMap<>(outcomes));
        try {
            videoRepository.save(video);
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to record publish progress for video " + video.getId(), e);
        }
    }

    private void finishPublish(Video video, Map<Platform, PublishOutcome> outcomes, PersistenceException persistenceFailure) {
        LocalDateTime now = LocalDateTime.now(clock);
        for (Platform platform : video.getSelectedPlatforms()) {
            outcomes.putIfAbsent(platform, PublishOutcome.failed("Publishing interrupted", now));
        }

        List<String> failures = new ArrayList<>();
        outcomes.forEach((platform, outcome) -> {
            if (outcome.isFailed()) {
                failures.add(platform.getDisplayName() + ": " + outcome.error());
            }
        });
        boolean anyPosted = outcomes.values().stream().anyMatch(PublishOutcome::isPosted);

        video.setPublishedPlatforms(new LinkedHashMap<>(outcomes));
        if (persistenceFailure != null) {
            video.setStatus(VideoStatus.ERROR);
            video.setErrorMessage(persistenceFailure.getMessage());
        } else {
            video.setStatus(anyPosted ? VideoStatus.POSTED : VideoStatus.FAILED);
            if (!failures.isEmpty()) {
                video.setErrorMessage("Some platforms failed to publish: " + String.join("; ", failures));
            } else if (!anyPosted) {
                video.setErrorMessage(AppConstants.NO_CREDENTIALS_REASON + " for any selected platform");
            } else {
                video.setErrorMessage(null);
            }
        }

        try {
            videoRepository.save(video);
            log.info("Video {} finished publishing as {}", video.getId(), video.getStatus());
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to record publish outcome for video " + video.getId(), e);
        }
    }
}
