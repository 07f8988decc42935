package com.tokenvault.backend.auth.user;

public enum UserRole {
    USER,
    ADMIN
}
