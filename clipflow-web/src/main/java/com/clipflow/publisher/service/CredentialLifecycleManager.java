package com.clipflow.publisher.service;

import com.clipflow.publisher.client.CredentialExchangeClient;
import com.clipflow.publisher.client.ExchangedToken;
import com.clipflow.publisher.client.TokenIntrospection;
import com.clipflow.publisher.dto.CredentialState;
import com.clipflow.publisher.dto.CredentialStatus;
import com.clipflow.publisher.dto.TokenRefreshResult;
import com.clipflow.publisher.dto.TokenRefreshResult.FailureReason;
import com.clipflow.publisher.dto.TokenValidation;
import com.clipflow.publisher.dto.ValidToken;
import com.clipflow.publisher.exception.CredentialException;
import com.clipflow.publisher.exception.NetworkException;
import com.clipflow.publisher.exception.PersistenceException;
import com.clipflow.publisher.exception.PipelineException;
import com.clipflow.publisher.model.Platform;
import com.clipflow.publisher.model.PlatformCredential;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Keeps one platform's access credential usable: validation against the remote introspection
 * endpoint, long-lived token exchange, and expiry reporting.
 *
 * <p>States: ABSENT, ACTIVE, EXPIRING_SOON, EXPIRED and INVALID. A stored record past its expiry
 * is EXPIRED without a remote call.
 */
@Slf4j
public class CredentialLifecycleManager {

    static final Duration DEFAULT_TOKEN_LIFETIME = Duration.ofDays(60);

    private final Platform platform;
    private final CredentialStore store;
    private final CredentialExchangeClient exchangeClient;
    private final Clock clock;
    private final Duration warningWindow;
    private final Duration refreshWindow;

    public CredentialLifecycleManager(Platform platform, CredentialStore store, CredentialExchangeClient exchangeClient,
                                      Clock clock, Duration warningWindow, Duration refreshWindow) {
        this.platform = platform;
        this.store = store;
        this.exchangeClient = exchangeClient;
        this.clock = clock;
        this.warningWindow = warningWindow;
        this.refreshWindow = refreshWindow;
    }

    public Platform getPlatform() {
        return platform;
    }

    /**
     * Validates the active credential. Expired or remotely rejected credentials are deactivated.
     */
    public TokenValidation validate() {
        Optional<PlatformCredential> credential = store.findActive(platform);
        if (credential.isEmpty()) {
            return TokenValidation.absent();
        }
        return inspect(credential.get(), true);
    }

    /**
     * Exchanges the current token for a long-lived one and stores it as the new active credential.
     * Never throws; failures come back with a reason and leave the stored credential untouched.
     */
    public TokenRefreshResult refresh() {
        Optional<PlatformCredential> current = store.findCurrent(platform);
        if (current.isEmpty()) {
            return TokenRefreshResult.failed(FailureReason.MISSING_CONFIG,
                    "No " + platform.getDisplayName() + " credential stored");
        }
        if (!exchangeClient.isConfigured()) {
            return TokenRefreshResult.failed(FailureReason.MISSING_CONFIG,
                    "Refresh token, app ID, or app secret not configured");
        }

        PlatformCredential credential = current.get();
        ExchangedToken exchanged;
        try {
            exchanged = exchangeClient.exchangeForLongLivedToken(credential.getAccessToken());
        } catch (NetworkException e) {
            log.warn("{} token refresh could not reach the server: {}", platform, e.getMessage());
            return TokenRefreshResult.failed(FailureReason.NETWORK_FAILURE, e.getMessage());
        } catch (PipelineException e) {
            log.warn("{} token refresh rejected: {}", platform, e.getMessage());
            return TokenRefreshResult.failed(FailureReason.REMOTE_REJECTED, e.getMessage());
        }

        LocalDateTime now = LocalDateTime.now(clock);
        Duration lifetime = exchanged.expiresInSeconds() > 0
                ? Duration.ofSeconds(exchanged.expiresInSeconds())
                : DEFAULT_TOKEN_LIFETIME;
        LocalDateTime expiresAt = now.plus(lifetime);
        try {
            store.replace(credential, credential.renew(exchanged.accessToken(), expiresAt, now));
        } catch (PersistenceException e) {
            log.warn("{} token refresh could not be stored: {}", platform, e.getMessage());
            return TokenRefreshResult.failed(FailureReason.CONFLICT, e.getMessage());
        }
        log.info("Refreshed {} token, new expiry {}", platform, expiresAt);
        return TokenRefreshResult.refreshed(exchanged.accessToken(), expiresAt);
    }

    /** True when the active credential expires within {@code threshold} and has not expired yet. */
    public boolean isExpiringSoon(Duration threshold) {
        return store.findActive(platform)
                .map(credential -> expiresWithin(credential, threshold))
                .orElse(false);
    }

    public boolean isExpiringSoon() {
        return isExpiringSoon(warningWindow);
    }

    /** Whether a publish should refresh the token before using it. */
    public boolean needsProactiveRefresh() {
        return isExpiringSoon(refreshWindow);
    }

    public boolean hasUsableCredential() {
        return store.findActive(platform)
                .map(credential -> !credential.isExpired(LocalDateTime.now(clock)))
                .orElse(false);
    }

    /**
     * Token to use for the next call. Attempts at most one refresh; when that fails too, the stale
     * token comes back together with the error and the stored credential is left as it was.
     */
    public ValidToken getValidToken() {
        Optional<PlatformCredential> current = store.findCurrent(platform);
        if (current.isEmpty()) {
            return new ValidToken(null, null, "No " + platform.getDisplayName() + " access token configured");
        }
        PlatformCredential credential = current.get();
        TokenValidation validation = credential.isActive()
                ? inspect(credential, false)
                : TokenValidation.invalid(credential.getExpiresAt(), "Credential is inactive");
        if (validation.valid()) {
            return new ValidToken(credential.getAccessToken(), credential.getAccountId(), null);
        }

        log.info("{} token not valid ({}), attempting refresh", platform, validation.error());
        TokenRefreshResult refreshed = refresh();
        if (refreshed.success()) {
            return new ValidToken(refreshed.accessToken(), credential.getAccountId(), null);
        }
        String error = refreshed.error() != null ? refreshed.error() : validation.error();
        return new ValidToken(credential.getAccessToken(), credential.getAccountId(),
                error != null ? error : "Unable to get valid token");
    }

    /** Token for a call that cannot proceed without one. */
    public ValidToken requireToken() {
        ValidToken token = getValidToken();
        if (!token.hasToken()) {
            throw new CredentialException(platform, token.error());
        }
        return token;
    }

    public CredentialStatus status() {
        Optional<PlatformCredential> credential = store.findActive(platform);
        TokenValidation validation = validate();
        return new CredentialStatus(
                platform,
                credential.isPresent(),
                validation.valid(),
                validation.state(),
                validation.expiresAt(),
                credential.map(c -> expiresWithin(c, warningWindow)).orElse(false),
                validation.scopes(),
                credential.map(PlatformCredential::getAccountName).orElse(null),
                credential.map(PlatformCredential::getLastRefreshedAt).orElse(null),
                validation.error());
    }

    private TokenValidation inspect(PlatformCredential credential, boolean deactivateOnFailure) {
        LocalDateTime now = LocalDateTime.now(clock);
        if (credential.isExpired(now)) {
            if (deactivateOnFailure) {
                store.deactivate(credential);
            }
            return TokenValidation.expired(credential.getExpiresAt());
        }

        TokenIntrospection introspection;
        try {
            introspection = exchangeClient.introspect(credential.getAccessToken());
        } catch (PipelineException e) {
            log.warn("{} token validation failed: {}", platform, e.getMessage());
            return new TokenValidation(false, CredentialState.ACTIVE, credential.getExpiresAt(),
                    List.of(), "Failed to validate token: " + e.getMessage());
        }

        if (!introspection.valid()) {
            if (deactivateOnFailure) {
                store.deactivate(credential);
            }
            return TokenValidation.invalid(introspection.expiresAt(), introspection.error());
        }

        LocalDateTime expiresAt = introspection.expiresAt() != null ? introspection.expiresAt() : credential.getExpiresAt();
        boolean expiringSoon = expiresAt != null && Duration.between(now, expiresAt).compareTo(warningWindow) < 0;
        return new TokenValidation(true,
                expiringSoon ? CredentialState.EXPIRING_SOON : CredentialState.ACTIVE,
                expiresAt, introspection.scopes(), null);
    }

    private boolean expiresWithin(PlatformCredential credential, Duration threshold) {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime expiresAt = credential.getExpiresAt();
        return expiresAt != null && expiresAt.isAfter(now) && Duration.between(now, expiresAt).compareTo(threshold) < 0;
    }
}
