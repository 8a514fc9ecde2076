package com.myancamp.backend.modules.auth.domain;

import jakarta.persistence.Entity;
import jakarta.persistence.Table;

@Entity
@Table(name = "email_verification_token")
public class EmailVerificationToken extends SingleUseToken {

    @Override
    public SingleUseTokenKind getKind() {
        return SingleUseTokenKind.EMAIL_VERIFICATION;
    }
}
