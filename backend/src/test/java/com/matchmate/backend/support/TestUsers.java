package com.matchmate.backend.support;

import java.lang.reflect.Field;
import java.util.UUID;

import com.matchmate.backend.modules.auth.domain.AppUser;

/**
 * Builds detached {@link AppUser} instances with a fixed id for unit tests.
 */
public final class TestUsers {

    private TestUsers() {
        // utility
    }

    public static AppUser user(String id, String name) {
        AppUser user = new AppUser();
        user.setName(name);
        user.setEmail(name.toLowerCase() + "@example.com");
        user.setPasswordHash("hash");
        user.setActive(true);
        assignId(user, UUID.fromString(id));
        return user;
    }

    public static void assignId(AppUser user, UUID id) {
        try {
            Field idField = AppUser.class.getDeclaredField("id");
            idField.setAccessible(true);
            idField.set(user, id);
        } catch (ReflectiveOperationException ex) {
            throw new IllegalStateException(ex);
        }
    }
}
