package com.myancamp.backend.modules.auth.infrastructure.oauth;

import com.fasterxml.jackson.databind.JsonNode;
import com.myancamp.backend.modules.auth.domain.OAuthProvider;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

@Component
public class GoogleOAuthClient implements OAuthProviderClient {

    private final RestTemplate restTemplate;
    private final String clientId;
    private final String clientSecret;
    private final String tokenUri;
    private final String userInfoUri;

    public GoogleOAuthClient(
            RestTemplate restTemplate,
            @Value("${auth.oauth.google.client-id:}") String clientId,
            @Value("${auth.oauth.google.client-secret:}") String clientSecret,
            @Value("${auth.oauth.google.token-uri:https://oauth2.googleapis.com/token}") String tokenUri,
            @Value("${auth.oauth.google.user-info-uri:https://www.googleapis.com/oauth2/v3/userinfo}") String userInfoUri
    ) {
        this.restTemplate = restTemplate;
        this.clientId = clientId;
        this.clientSecret = clientSecret;
        this.tokenUri = tokenUri;
        this.userInfoUri = userInfoUri;
    }

    @Override
    public OAuthProvider provider() {
        return OAuthProvider.GOOGLE;
    }

    @Override
    public String exchangeCode(String code, String redirectUri) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("code", code);
        form.add("client_id", clientId);
        form.add("client_secret", clientSecret);
        form.add("redirect_uri", redirectUri);
        form.add("grant_type", "authorization_code");

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

        try {
            JsonNode body = restTemplate.postForObject(tokenUri, new HttpEntity<>(form, headers), JsonNode.class);
            String accessToken = body != null ? body.path("access_token").asText(null) : null;
            if (accessToken == null || accessToken.isBlank()) {
                throw new OAuthProviderException("Google token response did not contain an access token");
            }
            return accessToken;
        } catch (RestClientException ex) {
            throw new OAuthProviderException("Google token exchange failed", ex);
        }
    }

    @Override
    public OAuthProfile fetchProfile(String providerAccessToken) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(providerAccessToken);
        try {
            JsonNode body = restTemplate.exchange(userInfoUri, HttpMethod.GET, new HttpEntity<>(headers), JsonNode.class)
                    .getBody();
            if (body == null || body.path("sub").asText("").isBlank()) {
                throw new OAuthProviderException("Google user info did not contain a subject");
            }
            return new OAuthProfile(
                    OAuthProvider.GOOGLE,
                    body.path("sub").asText(),
                    body.path("email").asText(null),
                    body.path("name").asText(null),
                    body.path("picture").asText(null)
            );
        } catch (RestClientException ex) {
            throw new OAuthProviderException("Google user info request failed", ex);
        }
    }
}
