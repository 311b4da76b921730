package com.clipflow.publisher.client;

import com.clipflow.publisher.exception.ValidationException;
import com.clipflow.publisher.model.Platform;

/**
 * Exchange client for platforms whose token endpoints are not integrated yet. It reports itself as
 * unconfigured so refreshes fail with a missing-configuration reason.
 */
public class UnsupportedCredentialExchangeClient implements CredentialExchangeClient {
    private final Platform platform;

    public UnsupportedCredentialExchangeClient(Platform platform) {
        this.platform = platform;
    }

    @Override
    public boolean isConfigured() {
        return false;
    }

    @Override
    public TokenIntrospection introspect(String accessToken) {
        throw new ValidationException("Token validation is not available for " + platform.getDisplayName());
    }

    @Override
    public ExchangedToken exchangeForLongLivedToken(String accessToken) {
        throw new ValidationException("Token refresh is not available for " + platform.getDisplayName());
    }
}
