package com.clipflow.publisher.client;

import com.clipflow.publisher.model.Platform;
import com.clipflow.publisher.model.PlatformCaption;

import java.util.Map;

public interface CaptionGenerationClient {

    /** One caption per platform in {@code style}, as written by the model. */
    Map<Platform, PlatformCaption> generate(String transcript, String title, CaptionStyle style);
}
