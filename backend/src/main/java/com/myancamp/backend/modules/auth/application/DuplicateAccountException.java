package com.myancamp.backend.modules.auth.application;

import org.springframework.dao.DataIntegrityViolationException;

/**
 * A unique username, email or provider id was taken by a concurrent request between the existence
 * check and the insert. Services roll back on this exception even though other
 * {@link AuthException}s commit.
 */
public class DuplicateAccountException extends AuthException {

    public DuplicateAccountException(String detail, DataIntegrityViolationException cause) {
        super(AuthErrorCode.VALIDATION_ERROR, detail, cause);
    }
}
