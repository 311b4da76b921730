package com.clipflow.publisher.model;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CaptionSettingsTest {

    @Test
    void effectiveTone_shouldUseCustomToneOnlyWhenSelected() {
        CaptionSettings settings = CaptionSettings.defaults();
        settings.setCustomTone("dry humour");
        assertEquals("engaging", settings.effectiveTone());

        settings.setTone("custom");
        assertEquals("dry humour", settings.effectiveTone());
    }

    @Test
    void resolvedCallToAction_shouldSubstituteVariables() {
        CaptionSettings settings = CaptionSettings.defaults();
        settings.setCallToAction("Follow {handle} and visit {website}");
        settings.setCustomVariables(Map.of("handle", "@clipflow", "website", "clipflow.io"));

        assertEquals("Follow @clipflow and visit clipflow.io", settings.resolvedCallToAction());
    }

    @Test
    void hashtagCountFor_shouldHonourOverrideAndToggle() {
        CaptionSettings settings = CaptionSettings.defaults();
        assertEquals(Platform.INSTAGRAM.getDefaultHashtagCount(), settings.hashtagCountFor(Platform.INSTAGRAM));

        settings.setHashtagCount(2);
        assertEquals(2, settings.hashtagCountFor(Platform.INSTAGRAM));

        settings.setIncludeHashtags(false);
        assertEquals(0, settings.hashtagCountFor(Platform.INSTAGRAM));
    }

    @Test
    void styleFor_shouldPreferPlatformPrompt() {
        CaptionSettings settings = CaptionSettings.defaults();
        settings.setPlatformPrompts(Map.of(Platform.TIKTOK, "all lowercase"));

        assertEquals("all lowercase", settings.styleFor(Platform.TIKTOK));
        assertEquals(Platform.FACEBOOK.getDefaultStyle(), settings.styleFor(Platform.FACEBOOK));

        settings.setPlatformSpecific(false);
        assertEquals(Platform.TIKTOK.getDefaultStyle(), settings.styleFor(Platform.TIKTOK));
    }
}
