package com.myancamp.backend.modules.auth.infrastructure.persistence;

import com.myancamp.backend.modules.auth.domain.EmailVerificationToken;

public interface EmailVerificationTokenRepository extends SingleUseTokenRepository<EmailVerificationToken> {
}
