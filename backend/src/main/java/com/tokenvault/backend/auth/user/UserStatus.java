package com.tokenvault.backend.auth.user;

public enum UserStatus {
    ACTIVE,
    DISABLED
}
