package com.clipflow.publisher.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

public record AnalyticsPlatformConfigRequest(
        Boolean enabled,
        @Min(1) @Max(168) Integer fetchIntervalHours) {
}
