package com.myancamp.backend.modules.auth.infrastructure.persistence;

import com.myancamp.backend.modules.auth.domain.PasswordResetToken;

public interface PasswordResetTokenRepository extends SingleUseTokenRepository<PasswordResetToken> {
}
