package com.clipflow.publisher.dto;

import com.clipflow.publisher.model.Platform;

import java.util.List;

public record PlatformSummary(
        Platform platform,
        int postsCount,
        long totalViews,
        long totalEngagement,
        long totalReach,
        long totalImpressions,
        double averageEngagementRate,
        List<TopPost> topPerformingPosts) {
}
