package com.clipflow.publisher.service;

import com.clipflow.publisher.client.CaptionStyle;
import com.clipflow.publisher.dto.CaptionSettingsRequest;
import com.clipflow.publisher.model.CaptionSettings;
import com.clipflow.publisher.model.Platform;
import com.clipflow.publisher.repository.CaptionSettingsRepository;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

@Service
@RequiredArgsConstructor
@Slf4j
public class CaptionSettingsService {
    private final CaptionSettingsRepository repository;

    private final Cache<Long, CaptionSettings> settingsCache = Caffeine.newBuilder()
            .expireAfterWrite(5, TimeUnit.MINUTES)
            .maximumSize(1)
            .build();

    public CaptionSettings current() {
        return settingsCache.get(CaptionSettings.SINGLETON_ID, this::load);
    }

    public CaptionSettings update(CaptionSettingsRequest request) {
        CaptionSettings settings = repository.findById(CaptionSettings.SINGLETON_ID).orElseGet(CaptionSettings::defaults);
        if (request.systemPrompt() != null) settings.setSystemPrompt(request.systemPrompt());
        if (request.tone() != null) settings.setTone(request.tone());
        if (request.customTone() != null) settings.setCustomTone(request.customTone());
        if (request.callToAction() != null) settings.setCallToAction(request.callToAction());
        if (request.includeHashtags() != null) settings.setIncludeHashtags(request.includeHashtags());
        if (request.hashtagCount() != null) settings.setHashtagCount(request.hashtagCount());
        if (request.platformSpecific() != null) settings.setPlatformSpecific(request.platformSpecific());
        if (request.platformPrompts() != null) {
            Map<Platform, String> prompts = new EnumMap<>(Platform.class);
            request.platformPrompts().forEach((name, prompt) -> prompts.put(Platform.fromValue(name), prompt));
            settings.setPlatformPrompts(new LinkedHashMap<>(prompts));
        }
        if (request.customVariables() != null) {
            settings.setCustomVariables(new LinkedHashMap<>(request.customVariables()));
        }

        CaptionSettings saved = repository.save(settings);
        settingsCache.invalidateAll();
        log.info("Caption settings updated");
        return saved;
    }

    public CaptionStyle toStyle(CaptionSettings settings) {
        Map<Platform, CaptionStyle.PlatformStyle> platforms = new EnumMap<>(Platform.class);
        for (Platform platform : Platform.values()) {
            platforms.put(platform, new CaptionStyle.PlatformStyle(
                    platform.getMaxCaptionLength(),
                    settings.styleFor(platform),
                    settings.hashtagCountFor(platform)));
        }
        return new CaptionStyle(settings.getSystemPrompt(), settings.effectiveTone(), settings.resolvedCallToAction(), platforms);
    }

    private CaptionSettings load(Long id) {
        try {
            return repository.findById(id).orElseGet(CaptionSettings::defaults);
        } catch (DataAccessException e) {
            log.warn("Failed to load caption settings, using defaults", e);
            return CaptionSettings.defaults();
        }
    }
}
