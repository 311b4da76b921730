package com.clipflow.publisher.dto;

import com.clipflow.publisher.model.Platform;

import java.time.LocalDateTime;
import java.util.Map;

public record AnalyticsSummary(
        long totalVideos,
        long totalPosts,
        long totalViews,
        long totalEngagement,
        long totalReach,
        long totalImpressions,
        LocalDateTime periodStart,
        LocalDateTime periodEnd,
        TopPostRanking ranking,
        Map<Platform, PlatformSummary> platforms) {
}
