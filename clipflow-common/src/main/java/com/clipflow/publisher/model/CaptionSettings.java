package com.clipflow.publisher.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Single-row settings steering caption generation.
 */
@Data
@NoArgsConstructor
@Entity
@Table(name = "caption_settings")
public class CaptionSettings {
    public static final long SINGLETON_ID = 1L;

    @Id
    private Long id = SINGLETON_ID;

    @Column(length = 5000)
    private String systemPrompt;

    private String tone = "engaging";
    private String customTone;

    @Column(length = 1000)
    private String callToAction;

    private boolean includeHashtags = true;

    // Overrides each platform's default hashtag count when set
    private Integer hashtagCount;

    private boolean platformSpecific = true;

    @JdbcTypeCode(SqlTypes.JSON)
    private Map<Platform, String> platformPrompts = new LinkedHashMap<>();

    // brandName, website, handle
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, String> customVariables = new LinkedHashMap<>();

    @UpdateTimestamp
    private LocalDateTime updatedAt;

    public static CaptionSettings defaults() {
        return new CaptionSettings();
    }

    public String effectiveTone() {
        if ("custom".equalsIgnoreCase(tone) && customTone != null && !customTone.isBlank()) {
            return customTone;
        }
        return tone;
    }

    /** Call-to-action with {brandName}, {website} and {handle} substituted. Null when unset. */
    public String resolvedCallToAction() {
        if (callToAction == null || callToAction.isBlank()) {
            return null;
        }
        String resolved = callToAction;
        if (customVariables != null) {
            for (Map.Entry<String, String> variable : customVariables.entrySet()) {
                String value = variable.getValue() == null ? "" : variable.getValue();
                resolved = resolved.replace("{" + variable.getKey() + "}", value);
            }
        }
        return resolved.trim();
    }

    public String styleFor(Platform platform) {
        if (platformSpecific && platformPrompts != null) {
            String prompt = platformPrompts.get(platform);
            if (prompt != null && !prompt.isBlank()) {
                return prompt;
            }
        }
        return platform.getDefaultStyle();
    }

    public int hashtagCountFor(Platform platform) {
        if (!includeHashtags) {
            return 0;
        }
        return hashtagCount != null ? hashtagCount : platform.getDefaultHashtagCount();
    }
}
