package com.clipflow.publisher.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

import java.util.Map;

public record CaptionSettingsRequest(
        String systemPrompt,
        String tone,
        String customTone,
        String callToAction,
        Boolean includeHashtags,
        @Min(0) @Max(30) Integer hashtagCount,
        Boolean platformSpecific,
        Map<String, String> platformPrompts,
        Map<String, String> customVariables) {
}
