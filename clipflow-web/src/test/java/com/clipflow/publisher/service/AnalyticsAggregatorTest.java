package com.clipflow.publisher.service;

import com.clipflow.publisher.dto.AnalyticsSummary;
import com.clipflow.publisher.dto.PlatformSummary;
import com.clipflow.publisher.dto.TopPost;
import com.clipflow.publisher.dto.TopPostRanking;
import com.clipflow.publisher.exception.ValidationException;
import com.clipflow.publisher.model.Platform;
import com.clipflow.publisher.model.Post;
import com.clipflow.publisher.repository.PostRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AnalyticsAggregatorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-31T00:00:00Z"), ZoneOffset.UTC);
    private static final LocalDateTime NOW = LocalDateTime.now(CLOCK);

    @Mock
    private PostRepository postRepository;

    private AnalyticsAggregator aggregator;

    @BeforeEach
    void setUp() {
        aggregator = new AnalyticsAggregator(postRepository, CLOCK);
    }

    private static Post post(long id, long videoId, Platform platform, long impressions, long engagement, long views,
                             LocalDateTime publishedAt) {
        Post post = new Post(videoId, platform, "remote-" + id, "https://example.com/" + id, "caption " + id, publishedAt);
        post.setId(id);
        post.setImpressions(impressions);
        post.setReach(impressions / 2);
        post.setEngagement(engagement);
        post.setViews(views);
        return post;
    }

    @Test
    void summary_shouldAggregateAcrossPlatforms() {
        List<Post> posts = List.of(
                post(1, 10, Platform.FACEBOOK, 1000, 50, 400, NOW.minusDays(2)),
                post(2, 10, Platform.INSTAGRAM, 500, 100, 300, NOW.minusDays(2)),
                post(3, 11, Platform.FACEBOOK, 3000, 90, 100, NOW.minusDays(5)));
        when(postRepository.findByPublishedAtGreaterThanEqual(NOW.minusDays(30))).thenReturn(posts);

        AnalyticsSummary summary = aggregator.summary(30, null, TopPostRanking.ENGAGEMENT);

        assertEquals(2, summary.totalVideos());
        assertEquals(3, summary.totalPosts());
        assertEquals(800, summary.totalViews());
        assertEquals(240, summary.totalEngagement());
        assertEquals(4500, summary.totalImpressions());
        assertEquals(NOW.minusDays(30), summary.periodStart());
        assertEquals(NOW, summary.periodEnd());

        PlatformSummary facebook = summary.platforms().get(Platform.FACEBOOK);
        assertEquals(2, facebook.postsCount());
        assertEquals(140, facebook.totalEngagement());
        assertEquals(3.5, facebook.averageEngagementRate());
        assertEquals(20.0, summary.platforms().get(Platform.INSTAGRAM).averageEngagementRate());
        assertFalse(summary.platforms().containsKey(Platform.TIKTOK));
    }

    @Test
    void summary_shouldQuerySinglePlatform() {
        when(postRepository.findByPlatformAndPublishedAtGreaterThanEqual(Platform.INSTAGRAM, NOW.minusDays(7)))
                .thenReturn(List.of(post(2, 10, Platform.INSTAGRAM, 500, 100, 300, NOW.minusDays(2))));

        AnalyticsSummary summary = aggregator.summary(7, Platform.INSTAGRAM, TopPostRanking.ENGAGEMENT);

        assertEquals(1, summary.platforms().size());
        verify(postRepository, never()).findByPublishedAtGreaterThanEqual(any());
    }

    @Test
    void summary_shouldRejectEmptyPeriod() {
        assertThrows(ValidationException.class, () -> aggregator.summary(0, null, TopPostRanking.ENGAGEMENT));
        verifyNoInteractions(postRepository);
    }

    @Test
    void summarize_shouldReturnZerosForNoPosts() {
        AnalyticsSummary summary = aggregator.summarize(List.of(), NOW.minusDays(1), NOW, TopPostRanking.ENGAGEMENT);

        assertEquals(0, summary.totalPosts());
        assertEquals(0, summary.totalVideos());
        assertTrue(summary.platforms().isEmpty());
    }

    @Test
    void summarize_shouldLimitTopPostsAndBreakTiesById() {
        List<Post> posts = new ArrayList<>();
        for (long id = 8; id >= 1; id--) {
            posts.add(post(id, id, Platform.FACEBOOK, 100, id <= 3 ? 50 : 10, 0, NOW.minusDays(1)));
        }

        AnalyticsSummary summary = aggregator.summarize(posts, NOW.minusDays(30), NOW, TopPostRanking.ENGAGEMENT);

        List<Long> topIds = summary.platforms().get(Platform.FACEBOOK).topPerformingPosts().stream()
                .map(TopPost::postId)
                .toList();
        assertEquals(List.of(1L, 2L, 3L, 4L, 5L), topIds);
    }

    @Test
    void summarize_shouldRankByRecency() {
        List<Post> posts = List.of(
                post(1, 1, Platform.FACEBOOK, 100, 90, 0, NOW.minusDays(10)),
                post(2, 2, Platform.FACEBOOK, 100, 10, 0, NOW.minusDays(1)),
                post(3, 3, Platform.FACEBOOK, 100, 50, 0, null));

        AnalyticsSummary summary = aggregator.summarize(posts, NOW.minusDays(30), NOW, TopPostRanking.RECENCY);

        List<Long> topIds = summary.platforms().get(Platform.FACEBOOK).topPerformingPosts().stream()
                .map(TopPost::postId)
                .toList();
        assertEquals(List.of(2L, 1L, 3L), topIds);
    }

    @Test
    void engagementRate_shouldRoundToTwoDecimals() {
        assertEquals(33.33, AnalyticsAggregator.engagementRate(1, 3));
        assertEquals(0.0, AnalyticsAggregator.engagementRate(10, 0));
        assertEquals(150.0, AnalyticsAggregator.engagementRate(3, 2));
    }
}
