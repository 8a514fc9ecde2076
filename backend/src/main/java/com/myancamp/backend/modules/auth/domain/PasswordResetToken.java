package com.myancamp.backend.modules.auth.domain;

import jakarta.persistence.Entity;
import jakarta.persistence.Table;

@Entity
@Table(name = "password_reset_token")
public class PasswordResetToken extends SingleUseToken {

    @Override
    public SingleUseTokenKind getKind() {
        return SingleUseTokenKind.PASSWORD_RESET;
    }
}
