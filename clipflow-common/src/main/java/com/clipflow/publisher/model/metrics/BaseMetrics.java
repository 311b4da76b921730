package com.clipflow.publisher.model.metrics;

/**
 * Metrics every platform reports, in the platform-neutral vocabulary used by summaries.
 */
public record BaseMetrics(
        long impressions,
        long reach,
        long engagement,
        long clicks,
        long shares,
        long comments,
        long likes,
        long views) {

    public static final BaseMetrics ZERO = new BaseMetrics(0, 0, 0, 0, 0, 0, 0, 0);

    public BaseMetrics plus(BaseMetrics other) {
        return new BaseMetrics(
                impressions + other.impressions,
                reach + other.reach,
                engagement + other.engagement,
                clicks + other.clicks,
                shares + other.shares,
                comments + other.comments,
                likes + other.likes,
                views + other.views);
    }
}
