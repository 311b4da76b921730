package com.clipflow.publisher.client;

import com.clipflow.publisher.exception.InsightsNotReadyException;
import com.clipflow.publisher.exception.RemoteRejectionException;
import com.clipflow.publisher.model.Platform;
import com.clipflow.publisher.model.metrics.BaseMetrics;
import com.clipflow.publisher.model.metrics.FacebookMetrics;
import com.clipflow.publisher.model.metrics.PlatformMetrics;
import com.clipflow.publisher.model.metrics.ReactionBreakdown;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class FacebookInsightsSource implements InsightsSource {

    static final List<String> METRICS = List.of(
            "post_impressions",
            "post_impressions_unique",
            "post_engaged_users",
            "post_clicks",
            "post_reactions_by_type_total",
            "post_video_views",
            "post_video_views_unique",
            "post_video_views_organic",
            "post_video_views_paid",
            "post_video_view_time");

    private final FacebookGraphClient graphClient;

    @Override
    public Platform platform() {
        return Platform.FACEBOOK;
    }

    @Override
    public PlatformMetrics fetchMetrics(String remotePostId, String accessToken) {
        Map<String, JsonNode> values;
        try {
            values = graphClient.fetchInsights(remotePostId, METRICS, accessToken, Platform.FACEBOOK);
        } catch (RemoteRejectionException e) {
            if (e.getStatusCode() != 400) {
                throw e;
            }
            // Freshly published posts answer 400 until insights are computed
            log.info("No insights yet for Facebook post {}: {}", remotePostId, e.getMessage());
            throw new InsightsNotReadyException(e.getService(),
                    "Insights not available for Facebook post " + remotePostId + ": " + e.getMessage(),
                    toMetrics(Map.of()), e);
        }
        return toMetrics(values);
    }

    static FacebookMetrics toMetrics(Map<String, JsonNode> values) {
        ReactionBreakdown reactions = reactions(values.get("post_reactions_by_type_total"));
        long views = number(values, "post_video_views");
        BaseMetrics base = new BaseMetrics(
                number(values, "post_impressions"),
                number(values, "post_impressions_unique"),
                number(values, "post_engaged_users"),
                number(values, "post_clicks"),
                0,
                0,
                reactions.total(),
                views);
        return new FacebookMetrics(
                base,
                reactions,
                views,
                number(values, "post_video_view_time"),
                number(values, "post_video_views_unique"),
                number(values, "post_video_views_organic"),
                number(values, "post_video_views_paid"));
    }

    private static ReactionBreakdown reactions(JsonNode node) {
        if (node == null || !node.isObject()) {
            return ReactionBreakdown.NONE;
        }
        return new ReactionBreakdown(
                node.path("like").asLong(0),
                node.path("love").asLong(0),
                node.path("haha").asLong(0),
                node.path("wow").asLong(0),
                node.path("sad").asLong(0),
                node.path("angry").asLong(0));
    }

    private static long number(Map<String, JsonNode> values, String name) {
        JsonNode value = values.get(name);
        return value == null ? 0 : value.asLong(0);
    }
}
