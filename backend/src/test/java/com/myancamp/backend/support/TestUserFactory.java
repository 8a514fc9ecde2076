package com.myancamp.backend.support;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.myancamp.backend.modules.auth.domain.CampUser;
import com.myancamp.backend.modules.auth.domain.OwnerProfile;
import com.myancamp.backend.modules.auth.infrastructure.persistence.CampUserRepository;
import com.myancamp.backend.modules.auth.infrastructure.persistence.OwnerProfileRepository;

import org.springframework.boot.test.context.TestComponent;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.transaction.annotation.Transactional;

@TestComponent
public class TestUserFactory {

    public static final String DEFAULT_PASSWORD = "Campfire1!";

    private final CampUserRepository campUserRepository;
    private final OwnerProfileRepository ownerProfileRepository;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;

    public TestUserFactory(
            CampUserRepository campUserRepository,
            OwnerProfileRepository ownerProfileRepository,
            PasswordEncoder passwordEncoder,
            Clock clock
    ) {
        this.campUserRepository = campUserRepository;
        this.ownerProfileRepository = ownerProfileRepository;
        this.passwordEncoder = passwordEncoder;
        this.clock = clock;
    }

    @Transactional
    public CampUser verifiedUser(String username) {
        CampUser user = new CampUser();
        user.setUsername(username);
        user.setEmail(username + "@example.com");
        user.setPasswordHash(passwordEncoder.encode(DEFAULT_PASSWORD));
        user.setLocalPassword(true);
        user.markEmailVerified(OffsetDateTime.now(clock));
        return campUserRepository.save(user);
    }

    @Transactional
    public CampUser suspendedOwner(String username) {
        CampUser user = verifiedUser(username);
        user.setOwner(true);
        OwnerProfile profile = new OwnerProfile(user.getId(), username + " Campground");
        profile.suspend(OffsetDateTime.now(clock), "policy violation");
        ownerProfileRepository.save(profile);
        return campUserRepository.save(user);
    }
}
