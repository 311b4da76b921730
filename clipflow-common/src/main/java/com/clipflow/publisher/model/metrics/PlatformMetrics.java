package com.clipflow.publisher.model.metrics;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Metrics document collected for one post. Each variant embeds the shared {@link BaseMetrics}
 * and adds what only its platform reports.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = FacebookMetrics.class, name = "facebook"),
        @JsonSubTypes.Type(value = InstagramMetrics.class, name = "instagram")
})
public interface PlatformMetrics {

    BaseMetrics base();
}
