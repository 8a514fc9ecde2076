package com.myancamp.backend.support;

import java.util.UUID;

import com.myancamp.backend.modules.auth.domain.CampUser;

import org.springframework.test.util.ReflectionTestUtils;

/**
 * Detached users for unit tests that never touch the database.
 */
public final class TestCampUsers {

    private TestCampUsers() {
    }

    public static CampUser user(String username) {
        CampUser user = new CampUser();
        ReflectionTestUtils.setField(user, "id", UUID.randomUUID());
        user.setUsername(username);
        user.setEmail(username + "@example.com");
        user.setPasswordHash("hash");
        user.setLocalPassword(true);
        return user;
    }
}
