package com.clipflow.publisher.service;

import com.clipflow.publisher.client.InsightsSource;
import com.clipflow.publisher.dto.IngestionReport;
import com.clipflow.publisher.dto.ValidToken;
import com.clipflow.publisher.exception.CredentialException;
import com.clipflow.publisher.exception.InsightsNotReadyException;
import com.clipflow.publisher.exception.InvalidStateException;
import com.clipflow.publisher.exception.PipelineException;
import com.clipflow.publisher.exception.ValidationException;
import com.clipflow.publisher.model.AnalyticsPlatformConfig;
import com.clipflow.publisher.model.Platform;
import com.clipflow.publisher.model.Post;
import com.clipflow.publisher.model.PostMetricsSnapshot;
import com.clipflow.publisher.model.metrics.PlatformMetrics;
import com.clipflow.publisher.repository.PostMetricsSnapshotRepository;
import com.clipflow.publisher.repository.PostRepository;
import com.clipflow.publisher.util.AppConstants;
import io.github.bucket4j.Bucket;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Pulls insights for published posts and stores them on the post and in the hourly snapshot
 * series. A failure on one post is logged to the analytics error table and does not stop the run.
 * Platforms switched off in {@link AnalyticsPlatformConfig} are left alone.
 */
@Slf4j
@Service
public class AnalyticsIngestionService {

    private final PostRepository postRepository;
    private final PostMetricsSnapshotRepository snapshotRepository;
    private final CredentialManagerRegistry credentials;
    private final Map<Platform, InsightsSource> sources = new EnumMap<>(Platform.class);
    private final RetryExecutor retryExecutor;
    private final AnalyticsErrorService errorService;
    private final AnalyticsConfigService configService;
    private final Bucket rateLimiter;
    private final Clock clock;
    private final Duration minPostAge;
    private final int maxAttempts;
    private final Duration baseDelay;

    public AnalyticsIngestionService(PostRepository postRepository,
                                     PostMetricsSnapshotRepository snapshotRepository,
                                     CredentialManagerRegistry credentials,
                                     List<InsightsSource> sources,
                                     RetryExecutor retryExecutor,
                                     AnalyticsErrorService errorService,
                                     AnalyticsConfigService configService,
                                     @Qualifier("insightsRateLimiter") Bucket rateLimiter,
                                     Clock clock,
                                     @Value("${app.analytics.min-post-age:1h}") Duration minPostAge,
                                     @Value("${app.analytics.retry.max-attempts:3}") int maxAttempts,
                                     @Value("${app.analytics.retry.base-delay:1s}") Duration baseDelay) {
        this.postRepository = postRepository;
        this.snapshotRepository = snapshotRepository;
        this.credentials = credentials;
        sources.forEach(source -> this.sources.put(source.platform(), source));
        this.retryExecutor = retryExecutor;
        this.errorService = errorService;
        this.configService = configService;
        this.rateLimiter = rateLimiter;
        this.clock = clock;
        this.minPostAge = minPostAge;
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
    }

    /** Manual refresh of every enabled platform, regardless of when each was last collected. */
    public IngestionReport refreshAll(boolean force) {
        IngestionReport report = IngestionReport.EMPTY;
        for (Platform platform : sources.keySet()) {
            if (!configService.isEnabled(platform)) {
                log.info("Analytics disabled for {}, skipping", platform);
                continue;
            }
            report = report.plus(refreshPlatformPosts(platform, force));
        }
        log.info("Analytics refresh finished: {} updated, {} skipped, {} failed",
                report.updated(), report.skipped(), report.failed());
        return report;
    }

    /** Recurring refresh: only enabled platforms whose fetch interval has elapsed. */
    public IngestionReport refreshScheduled() {
        LocalDateTime now = LocalDateTime.now(clock);
        IngestionReport report = IngestionReport.EMPTY;
        for (Platform platform : sources.keySet()) {
            AnalyticsPlatformConfig config = configService.forPlatform(platform);
            if (!config.isDueAt(now)) {
                log.debug("{} analytics not due (enabled={}, next fetch {})", platform, config.isEnabled(), config.getNextFetchAt());
                continue;
            }
            report = report.plus(refreshPlatformPosts(platform, false));
        }
        log.info("Scheduled analytics refresh finished: {} updated, {} skipped, {} failed",
                report.updated(), report.skipped(), report.failed());
        return report;
    }

    public IngestionReport refreshPlatform(Platform platform, boolean force) {
        if (!sources.containsKey(platform)) {
            throw new ValidationException("Analytics are not collected for " + platform.getDisplayName());
        }
        if (!configService.isEnabled(platform)) {
            throw new InvalidStateException("Analytics are disabled for " + platform.getDisplayName());
        }
        IngestionReport report = refreshPlatformPosts(platform, force);
        log.info("{} analytics refresh finished: {} updated, {} skipped, {} failed",
                platform, report.updated(), report.skipped(), report.failed());
        return report;
    }

    public IngestionReport refreshVideo(Long videoId, boolean force) {
        Map<Platform, List<Post>> byPlatform = postRepository.findByVideoId(videoId).stream()
                .collect(Collectors.groupingBy(Post::getPlatform, () -> new EnumMap<>(Platform.class), Collectors.toList()));
        IngestionReport report = IngestionReport.EMPTY;
        for (Map.Entry<Platform, List<Post>> entry : byPlatform.entrySet()) {
            if (sources.containsKey(entry.getKey()) && configService.isEnabled(entry.getKey())) {
                report = report.plus(refresh(entry.getKey(), entry.getValue(), force).report());
            }
        }
        log.info("Analytics refresh for video {}: {} updated, {} skipped, {} failed",
                videoId, report.updated(), report.skipped(), report.failed());
        return report;
    }

    private IngestionReport refreshPlatformPosts(Platform platform, boolean force) {
        LocalDateTime startedAt = LocalDateTime.now(clock);
        PlatformRun run = refresh(platform, postRepository.findByPlatform(platform), force);
        configService.recordRun(platform, run.lastError(), startedAt);
        return run.report();
    }

    private PlatformRun refresh(Platform platform, List<Post> posts, boolean force) {
        if (posts.isEmpty()) {
            return new PlatformRun(IngestionReport.EMPTY, null);
        }
        ValidToken token = credentials.forPlatform(platform).getValidToken();
        if (!token.hasToken()) {
            log.warn("Skipping {} analytics: {}", platform, token.error());
            errorService.record(platform, AppConstants.ERROR_TOKEN,
                    new CredentialException(platform, token.error()), Map.of("posts", posts.size()));
            return new PlatformRun(new IngestionReport(0, 0, posts.size()), token.error());
        }

        InsightsSource source = sources.get(platform);
        LocalDateTime now = LocalDateTime.now(clock);
        int updated = 0;
        int skipped = 0;
        int failed = 0;
        String lastError = null;
        for (Post post : posts) {
            if (!force && isTooRecent(post, now)) {
                skipped++;
                continue;
            }
            try {
                awaitRateLimit();
                store(post, fetch(source, post, token.accessToken()), LocalDateTime.now(clock));
                updated++;
            } catch (RuntimeException e) {
                failed++;
                lastError = e.getMessage();
                log.error("Failed to update analytics for {} post {}", platform, post.getRemotePostId(), e);
                errorService.record(platform, AppConstants.ERROR_POST_ANALYTICS, e, Map.of(
                        "postId", post.getId(),
                        "remotePostId", post.getRemotePostId()));
            }
        }
        return new PlatformRun(new IngestionReport(updated, skipped, failed), lastError);
    }

    private PlatformMetrics fetch(InsightsSource source, Post post, String accessToken) {
        try {
            return retryExecutor.execute(
                    () -> source.fetchMetrics(post.getRemotePostId(), accessToken),
                    maxAttempts, baseDelay, RetryExecutor::isRetryable);
        } catch (InsightsNotReadyException e) {
            // Zeros may only stand in for a post that has never been measured
            if (post.getLastAnalyticsUpdate() != null) {
                throw e;
            }
            log.info("Storing empty metrics for new {} post {}", post.getPlatform(), post.getRemotePostId());
            return e.getPlaceholder();
        }
    }

    private boolean isTooRecent(Post post, LocalDateTime now) {
        return post.getPublishedAt() != null && post.getPublishedAt().plus(minPostAge).isAfter(now);
    }

    private void store(Post post, PlatformMetrics metrics, LocalDateTime collectedAt) {
        post.applyMetrics(metrics, collectedAt);
        postRepository.save(post);

        LocalDateTime hour = collectedAt.truncatedTo(ChronoUnit.HOURS);
        PostMetricsSnapshot snapshot = snapshotRepository
                .findByPostIdAndPlatformAndCollectedAt(post.getId(), post.getPlatform(), hour)
                .orElseGet(() -> new PostMetricsSnapshot(post, hour));
        snapshot.record(metrics);
        snapshotRepository.save(snapshot);
    }

    private void awaitRateLimit() {
        try {
            rateLimiter.asBlocking().consume(1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PipelineException("Interrupted while waiting for the insights rate limiter", e);
        }
    }

    private record PlatformRun(IngestionReport report, String lastError) {
    }
}
