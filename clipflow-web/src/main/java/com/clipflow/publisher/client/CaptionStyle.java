package com.clipflow.publisher.client;

import com.clipflow.publisher.model.Platform;

import java.util.Map;

/**
 * Everything the caption model is told about voice and format.
 */
public record CaptionStyle(String systemPrompt, String tone, String callToAction, Map<Platform, PlatformStyle> platforms) {

    public record PlatformStyle(int maxLength, String style, int hashtagCount) {
    }
}
