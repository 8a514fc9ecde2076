package com.myancamp.backend.modules.auth.infrastructure.oauth;

import com.myancamp.backend.modules.auth.domain.OAuthProvider;

public interface OAuthProviderClient {

    OAuthProvider provider();

    /**
     * Exchanges an authorization code for a provider access token.
     *
     * @throws OAuthProviderException when the provider rejects the code or cannot be reached
     */
    String exchangeCode(String code, String redirectUri);

    OAuthProfile fetchProfile(String providerAccessToken);
}
