package com.clipflow.publisher.model.metrics;

public record InstagramMetrics(BaseMetrics base, long saves, long totalInteractions) implements PlatformMetrics {
}
