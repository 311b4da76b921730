package com.clipflow.publisher.service;

import com.clipflow.publisher.client.CredentialExchangeClient;
import com.clipflow.publisher.client.FacebookGraphClient;
import com.clipflow.publisher.client.UnsupportedCredentialExchangeClient;
import com.clipflow.publisher.model.Platform;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * One {@link CredentialLifecycleManager} per platform. Facebook pages and Instagram business
 * accounts share the Graph token endpoints.
 */
@Component
public class CredentialManagerRegistry {

    private final Map<Platform, CredentialLifecycleManager> managers = new EnumMap<>(Platform.class);

    public CredentialManagerRegistry(CredentialStore store,
                                     FacebookGraphClient graphClient,
                                     Clock clock,
                                     @Value("${app.credentials.warning-window:7d}") Duration warningWindow,
                                     @Value("${app.credentials.refresh-window:24h}") Duration refreshWindow) {
        for (Platform platform : Platform.values()) {
            CredentialExchangeClient exchangeClient = switch (platform) {
                case FACEBOOK, INSTAGRAM -> graphClient;
                case TIKTOK, YOUTUBE -> new UnsupportedCredentialExchangeClient(platform);
            };
            managers.put(platform, new CredentialLifecycleManager(
                    platform, store, exchangeClient, clock, warningWindow, refreshWindow));
        }
    }

    public CredentialLifecycleManager forPlatform(Platform platform) {
        return managers.get(platform);
    }
}
