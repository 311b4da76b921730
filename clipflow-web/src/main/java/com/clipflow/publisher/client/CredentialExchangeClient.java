package com.clipflow.publisher.client;

/**
 * Remote token endpoints a credential manager relies on.
 */
public interface CredentialExchangeClient {

    /** Whether the app id and secret needed for the calls below are present. */
    boolean isConfigured();

    TokenIntrospection introspect(String accessToken);

    ExchangedToken exchangeForLongLivedToken(String accessToken);
}
