package com.clipflow.publisher.exception;

import com.clipflow.publisher.model.metrics.PlatformMetrics;

/**
 * The platform has no insights for a post yet. Carries all-zero metrics that may stand in for a
 * post that was never measured.
 */
public class InsightsNotReadyException extends RemoteRejectionException {
    private final transient PlatformMetrics placeholder;

    public InsightsNotReadyException(String service, String message, PlatformMetrics placeholder, Throwable cause) {
        super(service, 400, message, cause);
        this.placeholder = placeholder;
    }

    public PlatformMetrics getPlaceholder() {
        return placeholder;
    }
}
