package com.grantlens.search.contact;

import java.util.Locale;

public enum UserTier {
    FREE(false),
    BASIC(false),
    ADVANCED(true),
    UNLIMITED(true);

    private final boolean contactAccess;

    UserTier(boolean contactAccess) {
        this.contactAccess = contactAccess;
    }

    public boolean canSeeEmails() {
        return contactAccess;
    }

    public static UserTier fromHeader(String value) {
        if (value == null || value.isBlank()) {
            return FREE;
        }
        try {
            return UserTier.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return FREE;
        }
    }
}
