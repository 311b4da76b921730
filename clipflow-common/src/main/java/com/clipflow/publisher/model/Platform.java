package com.clipflow.publisher.model;

import com.clipflow.publisher.exception.ValidationException;

import java.util.Locale;

/**
 * Social platforms a video can be published to, with the caption constraints each one imposes.
 */
public enum Platform {
    INSTAGRAM("Instagram", 2200, "engaging with emojis and storytelling", 10),
    FACEBOOK("Facebook", 500, "professional yet warm", 5),
    TIKTOK("TikTok", 150, "short, punchy, and viral", 3),
    YOUTUBE("YouTube", 1000, "descriptive and informative", 8);

    private final String displayName;
    private final int maxCaptionLength;
    private final String defaultStyle;
    private final int defaultHashtagCount;

    Platform(String displayName, int maxCaptionLength, String defaultStyle, int defaultHashtagCount) {
        this.displayName = displayName;
        this.maxCaptionLength = maxCaptionLength;
        this.defaultStyle = defaultStyle;
        this.defaultHashtagCount = defaultHashtagCount;
    }

    public String getDisplayName() { return displayName; }
    public int getMaxCaptionLength() { return maxCaptionLength; }
    public String getDefaultStyle() { return defaultStyle; }
    public int getDefaultHashtagCount() { return defaultHashtagCount; }

    /** Lowercase key used in JSON documents exchanged with the caption model. */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Platform fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Platform is required");
        }
        for (Platform platform : values()) {
            if (platform.name().equalsIgnoreCase(value.trim())) {
                return platform;
            }
        }
        throw new ValidationException("Unknown platform: " + value);
    }
}
