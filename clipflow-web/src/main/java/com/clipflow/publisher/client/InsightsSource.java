package com.clipflow.publisher.client;

import com.clipflow.publisher.model.Platform;
import com.clipflow.publisher.model.metrics.PlatformMetrics;

public interface InsightsSource {

    Platform platform();

    PlatformMetrics fetchMetrics(String remotePostId, String accessToken);
}
