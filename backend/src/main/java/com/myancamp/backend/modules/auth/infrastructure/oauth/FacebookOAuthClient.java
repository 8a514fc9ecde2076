package com.myancamp.backend.modules.auth.infrastructure.oauth;

import java.net.URI;

import com.fasterxml.jackson.databind.JsonNode;
import com.myancamp.backend.modules.auth.domain.OAuthProvider;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

@Component
public class FacebookOAuthClient implements OAuthProviderClient {

    private static final String PROFILE_FIELDS = "id,name,email,picture";

    private final RestTemplate restTemplate;
    private final String appId;
    private final String appSecret;
    private final String tokenUri;
    private final String profileUri;

    public FacebookOAuthClient(
            RestTemplate restTemplate,
            @Value("${auth.oauth.facebook.app-id:}") String appId,
            @Value("${auth.oauth.facebook.app-secret:}") String appSecret,
            @Value("${auth.oauth.facebook.token-uri:https://graph.facebook.com/v12.0/oauth/access_token}") String tokenUri,
            @Value("${auth.oauth.facebook.profile-uri:https://graph.facebook.com/me}") String profileUri
    ) {
        this.restTemplate = restTemplate;
        this.appId = appId;
        this.appSecret = appSecret;
        this.tokenUri = tokenUri;
        this.profileUri = profileUri;
    }

    @Override
    public OAuthProvider provider() {
        return OAuthProvider.FACEBOOK;
    }

    @Override
    public String exchangeCode(String code, String redirectUri) {
        URI uri = UriComponentsBuilder.fromUriString(tokenUri)
                .queryParam("client_id", appId)
                .queryParam("client_secret", appSecret)
                .queryParam("redirect_uri", redirectUri)
                .queryParam("code", code)
                .encode()
                .build()
                .toUri();
        try {
            JsonNode body = restTemplate.getForObject(uri, JsonNode.class);
            String accessToken = body != null ? body.path("access_token").asText(null) : null;
            if (accessToken == null || accessToken.isBlank()) {
                throw new OAuthProviderException("Facebook token response did not contain an access token");
            }
            return accessToken;
        } catch (RestClientException ex) {
            throw new OAuthProviderException("Facebook token exchange failed", ex);
        }
    }

    @Override
    public OAuthProfile fetchProfile(String providerAccessToken) {
        URI uri = UriComponentsBuilder.fromUriString(profileUri)
                .queryParam("fields", PROFILE_FIELDS)
                .queryParam("access_token", providerAccessToken)
                .encode()
                .build()
                .toUri();
        try {
            JsonNode body = restTemplate.getForObject(uri, JsonNode.class);
            if (body == null || body.path("id").asText("").isBlank()) {
                throw new OAuthProviderException("Facebook profile did not contain an id");
            }
            return new OAuthProfile(
                    OAuthProvider.FACEBOOK,
                    body.path("id").asText(),
                    body.path("email").asText(null),
                    body.path("name").asText(null),
                    body.path("picture").path("data").path("url").asText(null)
            );
        } catch (RestClientException ex) {
            throw new OAuthProviderException("Facebook profile request failed", ex);
        }
    }
}
