package com.myancamp.backend.modules.auth.application;

import com.myancamp.backend.modules.auth.domain.CampUser;
import com.myancamp.backend.modules.auth.domain.OwnerProfile;
import com.myancamp.backend.modules.auth.infrastructure.persistence.OwnerProfileRepository;

import org.springframework.stereotype.Component;

/**
 * A user is suspended directly, or through a suspended owner profile.
 */
@Component
public class AccountSuspensionChecker {

    private final OwnerProfileRepository ownerProfileRepository;

    public AccountSuspensionChecker(OwnerProfileRepository ownerProfileRepository) {
        this.ownerProfileRepository = ownerProfileRepository;
    }

    public boolean isSuspended(CampUser user) {
        if (user.isSuspended()) {
            return true;
        }
        if (!user.isOwner()) {
            return false;
        }
        return ownerProfileRepository.findById(user.getId())
                .map(OwnerProfile::isSuspended)
                .orElse(false);
    }

    public void ensureNotSuspended(CampUser user) {
        if (isSuspended(user)) {
            throw new AuthException(AuthErrorCode.ACCOUNT_SUSPENDED);
        }
    }
}
