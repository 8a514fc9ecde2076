package com.myancamp.backend.modules.auth.infrastructure.oauth;

import com.myancamp.backend.modules.auth.domain.OAuthProvider;

/**
 * Identity returned by a provider. {@code email} may be null (Facebook users without one).
 */
public record OAuthProfile(OAuthProvider provider, String subjectId, String email, String name, String pictureUrl) {
}
