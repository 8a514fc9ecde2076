package com.myancamp.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class PasswordPolicyTest {

    private final PasswordPolicy policy = new PasswordPolicy();

    @ParameterizedTest
    @ValueSource(strings = {"Camping1!", "Tent$Pole2024", "aB3#efgh"})
    void acceptsStrongPasswords(String password) {
        assertThatCode(() -> policy.validate(password)).doesNotThrowAnyException();
    }

    @ParameterizedTest
    @CsvSource({
            "Ab1!, at least 8 characters",
            "camping1!, uppercase",
            "CAMPING1!, lowercase",
            "Camping!!, number",
            "Camping11, special character"
    })
    void rejectsWeakPasswordsWithSpecificMessage(String password, String expectedFragment) {
        assertThatThrownBy(() -> policy.validate(password))
                .isInstanceOfSatisfying(AuthException.class, ex -> {
                    assertThat(ex.getErrorCode()).isEqualTo(AuthErrorCode.VALIDATION_ERROR);
                    assertThat(ex.getDetailMessage()).contains(expectedFragment);
                });
    }
}
