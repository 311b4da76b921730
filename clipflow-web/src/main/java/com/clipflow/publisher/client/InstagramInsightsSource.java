package com.clipflow.publisher.client;

import com.clipflow.publisher.model.Platform;
import com.clipflow.publisher.model.metrics.BaseMetrics;
import com.clipflow.publisher.model.metrics.InstagramMetrics;
import com.clipflow.publisher.model.metrics.PlatformMetrics;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Reel insights. Instagram reports plays rather than impressions, so plays fill both the
 * impressions and views columns.
 */
@Component
@RequiredArgsConstructor
public class InstagramInsightsSource implements InsightsSource {

    static final List<String> METRICS = List.of(
            "plays", "reach", "likes", "comments", "shares", "saved", "total_interactions");

    private final FacebookGraphClient graphClient;

    @Override
    public Platform platform() {
        return Platform.INSTAGRAM;
    }

    @Override
    public PlatformMetrics fetchMetrics(String remotePostId, String accessToken) {
        return toMetrics(graphClient.fetchInsights(remotePostId, METRICS, accessToken, Platform.INSTAGRAM));
    }

    static InstagramMetrics toMetrics(Map<String, JsonNode> values) {
        long plays = number(values, "plays");
        long likes = number(values, "likes");
        long comments = number(values, "comments");
        long shares = number(values, "shares");
        long saves = number(values, "saved");
        long interactions = number(values, "total_interactions");
        long engagement = interactions > 0 ? interactions : likes + comments + shares + saves;

        BaseMetrics base = new BaseMetrics(plays, number(values, "reach"), engagement, 0, shares, comments, likes, plays);
        return new InstagramMetrics(base, saves, interactions);
    }

    private static long number(Map<String, JsonNode> values, String name) {
        JsonNode value = values.get(name);
        return value == null ? 0 : value.asLong(0);
    }
}
