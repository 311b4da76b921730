package com.clipflow.publisher.model.metrics;

public record FacebookMetrics(
        BaseMetrics base,
        ReactionBreakdown reactions,
        long videoViews,
        long videoWatchTime,
        long uniqueVideoViews,
        long organicVideoViews,
        long paidVideoViews) implements PlatformMetrics {
}
