package com.clipflow.publisher.dto;

import com.clipflow.publisher.model.Platform;

import java.util.List;

/**
 * Selected platforms split by whether a usable credential exists.
 */
public record PublishPlan(List<Platform> available, List<Platform> skipped) {

    public PublishPlan {
        available = List.copyOf(available);
        skipped = List.copyOf(skipped);
    }
}
