package com.clipflow.publisher.service;

import com.clipflow.publisher.client.ExchangedToken;
import com.clipflow.publisher.client.FacebookGraphClient;
import com.clipflow.publisher.client.ManagedPage;
import com.clipflow.publisher.client.TokenIntrospection;
import com.clipflow.publisher.dto.ConnectedAccounts;
import com.clipflow.publisher.exception.PipelineException;
import com.clipflow.publisher.exception.ValidationException;
import com.clipflow.publisher.model.Platform;
import com.clipflow.publisher.model.PlatformCredential;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Completes the Facebook login handshake: the authorization code becomes a long-lived page token,
 * stored as the active Facebook credential and, when the page has a linked business account, as
 * the active Instagram credential too.
 */
@Slf4j
@Service
public class AccountConnectionService {

    private final FacebookGraphClient graphClient;
    private final CredentialStore credentialStore;
    private final Clock clock;
    private final String redirectUri;
    private final String preferredPageId;

    public AccountConnectionService(FacebookGraphClient graphClient,
                                    CredentialStore credentialStore,
                                    Clock clock,
                                    @Value("${app.facebook.redirect-uri:}") String redirectUri,
                                    @Value("${app.facebook.page-id:}") String preferredPageId) {
        this.graphClient = graphClient;
        this.credentialStore = credentialStore;
        this.clock = clock;
        this.redirectUri = redirectUri;
        this.preferredPageId = preferredPageId;
    }

    public ConnectedAccounts connect(String authorizationCode) {
        if (authorizationCode == null || authorizationCode.isBlank()) {
            throw new ValidationException("Authorization code is required");
        }
        ExchangedToken userToken = graphClient.exchangeAuthorizationCode(authorizationCode, redirectUri);
        ManagedPage page = choosePage(graphClient.listManagedPages(userToken.accessToken()));
        if (page.accessToken() == null) {
            throw new ValidationException("No access token granted for page " + page.name());
        }

        ExchangedToken pageToken = graphClient.exchangeForLongLivedToken(page.accessToken());
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime expiresAt = now.plus(pageToken.expiresInSeconds() > 0
                ? Duration.ofSeconds(pageToken.expiresInSeconds())
                : CredentialLifecycleManager.DEFAULT_TOKEN_LIFETIME);
        List<String> scopes = grantedScopes(pageToken.accessToken());

        Map<Platform, String> connected = new EnumMap<>(Platform.class);
        PlatformCredential facebook = new PlatformCredential(
                Platform.FACEBOOK, page.id(), page.name(), pageToken.accessToken(), expiresAt, now);
        facebook.setScopes(new ArrayList<>(scopes));
        credentialStore.activate(facebook);
        connected.put(Platform.FACEBOOK, page.name());
        log.info("Connected Facebook page {} ({})", page.name(), page.id());

        Optional<String> instagramId = graphClient.findInstagramAccountId(page.id(), pageToken.accessToken());
        if (instagramId.isPresent()) {
            PlatformCredential instagram = new PlatformCredential(
                    Platform.INSTAGRAM, instagramId.get(), page.name(), pageToken.accessToken(), expiresAt, now);
            instagram.setScopes(new ArrayList<>(scopes));
            credentialStore.activate(instagram);
            connected.put(Platform.INSTAGRAM, page.name());
            log.info("Connected Instagram account {} through page {}", instagramId.get(), page.id());
        }
        return new ConnectedAccounts(connected);
    }

    private ManagedPage choosePage(List<ManagedPage> pages) {
        if (pages.isEmpty()) {
            throw new ValidationException("The Facebook account does not manage any pages");
        }
        if (preferredPageId != null && !preferredPageId.isBlank()) {
            return pages.stream()
                    .filter(page -> preferredPageId.equals(page.id()))
                    .findFirst()
                    .orElseThrow(() -> new ValidationException("Page " + preferredPageId + " is not managed by this account"));
        }
        return pages.get(0);
    }

    private List<String> grantedScopes(String accessToken) {
        try {
            TokenIntrospection introspection = graphClient.introspect(accessToken);
            return introspection.scopes();
        } catch (PipelineException e) {
            log.warn("Could not read granted scopes: {}", e.getMessage());
            return List.of();
        }
    }
}
