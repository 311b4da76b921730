package com.clipflow.publisher.service;

import com.clipflow.publisher.dto.AnalyticsSummary;
import com.clipflow.publisher.dto.PlatformSummary;
import com.clipflow.publisher.dto.TopPost;
import com.clipflow.publisher.dto.TopPostRanking;
import com.clipflow.publisher.exception.ValidationException;
import com.clipflow.publisher.model.Platform;
import com.clipflow.publisher.model.Post;
import com.clipflow.publisher.model.metrics.BaseMetrics;
import com.clipflow.publisher.repository.PostRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Folds stored post metrics into per-platform and overall summaries for a time window.
 */
@Service
@RequiredArgsConstructor
public class AnalyticsAggregator {

    static final int TOP_POSTS = 5;

    private final PostRepository postRepository;
    private final Clock clock;

    /** Summary of posts published in the last {@code days} days, optionally for one platform. */
    public AnalyticsSummary summary(int days, Platform platform, TopPostRanking ranking) {
        if (days < 1) {
            throw new ValidationException("Period must be at least one day");
        }
        LocalDateTime periodEnd = LocalDateTime.now(clock);
        LocalDateTime periodStart = periodEnd.minusDays(days);
        List<Post> posts = platform == null
                ? postRepository.findByPublishedAtGreaterThanEqual(periodStart)
                : postRepository.findByPlatformAndPublishedAtGreaterThanEqual(platform, periodStart);
        return summarize(posts, periodStart, periodEnd, ranking);
    }

    public AnalyticsSummary summarize(List<Post> posts, LocalDateTime periodStart, LocalDateTime periodEnd,
                                      TopPostRanking ranking) {
        Map<Platform, List<Post>> byPlatform = posts.stream()
                .collect(Collectors.groupingBy(Post::getPlatform, () -> new EnumMap<>(Platform.class), Collectors.toList()));

        Map<Platform, PlatformSummary> platforms = new EnumMap<>(Platform.class);
        byPlatform.forEach((platform, platformPosts) -> platforms.put(platform, summarizePlatform(platform, platformPosts, ranking)));

        BaseMetrics totals = sum(posts);
        long totalVideos = posts.stream().map(Post::getVideoId).filter(Objects::nonNull).distinct().count();
        return new AnalyticsSummary(
                totalVideos,
                posts.size(),
                totals.views(),
                totals.engagement(),
                totals.reach(),
                totals.impressions(),
                periodStart,
                periodEnd,
                ranking,
                platforms);
    }

    private PlatformSummary summarizePlatform(Platform platform, List<Post> posts, TopPostRanking ranking) {
        BaseMetrics totals = sum(posts);
        List<TopPost> topPosts = posts.stream()
                .sorted(ranking.comparator())
                .limit(TOP_POSTS)
                .map(TopPost::from)
                .toList();
        return new PlatformSummary(
                platform,
                posts.size(),
                totals.views(),
                totals.engagement(),
                totals.reach(),
                totals.impressions(),
                engagementRate(totals.engagement(), totals.impressions()),
                topPosts);
    }

    /** Engagement as a percentage of impressions, rounded to two decimals; 0 without impressions. */
    static double engagementRate(long engagement, long impressions) {
        if (impressions <= 0) {
            return 0.0;
        }
        return Math.round(engagement * 10_000.0 / impressions) / 100.0;
    }

    private static BaseMetrics sum(List<Post> posts) {
        return posts.stream().map(Post::getMetrics).reduce(BaseMetrics.ZERO, BaseMetrics::plus);
    }
}
