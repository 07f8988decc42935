package com.tokenvault.backend.auth.user;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * [users 테이블 매핑 엔티티]
 *
 * - refresh_tokens.user_id 가 이 테이블을 FK로 참조한다. (ON DELETE CASCADE)
 * - 반대 방향(User -> RefreshToken 컬렉션)은 매핑하지 않는다. 소유 관계는 FK 하나로 충분
 * - clientId: Access Token의 clientId 클레임으로 들어가는 값
 */
@Getter
@Entity
@Table(name = "users", uniqueConstraints = {
        @UniqueConstraint(name = "uq_users_username", columnNames = "username"),
        @UniqueConstraint(name = "uq_users_email", columnNames = "email")
})
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class User {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 50)
    private String username;

    @Column(nullable = false, length = 255)
    private String email;

    @Column(name = "password_hash", nullable = false, length = 100)
    private String passwordHash;

    @Column(name = "first_name", length = 100)
    private String firstName;

    @Column(name = "last_name", length = 100)
    private String lastName;

    @Column(name = "client_id", nullable = false, length = 36)
    private String clientId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "user_roles", joinColumns = @JoinColumn(name = "user_id"))
    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 20)
    private Set<UserRole> roles = EnumSet.noneOf(UserRole.class);

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private UserStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Column(name = "last_login_at")
    private LocalDateTime lastLoginAt;

    @Column(name = "failed_login_attempts", nullable = false)
    private int failedLoginAttempts;

    // 이 시각 전까지 로그인 거절. null 이면 잠금 아님
    @Column(name = "lockout_end")
    private LocalDateTime lockoutEnd;

    public static User create(String username, String email, String passwordHash,
                              String firstName, String lastName, LocalDateTime now) {
        User u = new User();
        u.username = username;
        u.email = email;
        u.passwordHash = passwordHash;
        u.firstName = firstName;
        u.lastName = lastName;
        u.clientId = UUID.randomUUID().toString();
        u.roles = EnumSet.of(UserRole.USER);
        u.status = UserStatus.ACTIVE;
        u.createdAt = now;
        return u;
    }

    public boolean isActive() {
        return status == UserStatus.ACTIVE;
    }

    public boolean isLockedOut(LocalDateTime now) {
        return lockoutEnd != null && now.isBefore(lockoutEnd);
    }

    /**
     * 비밀번호 실패 1회 기록. maxAttempts 에 닿으면 now + duration 까지 잠그고 카운터를 비운다.
     * 잠금이 끝난 뒤에는 다시 maxAttempts 번의 기회가 생긴다.
     *
     * @return 이번 실패로 잠겼으면 true
     */
    public boolean recordFailedLogin(LocalDateTime now, int maxAttempts, Duration duration) {
        this.failedLoginAttempts++;
        this.updatedAt = now;
        if (failedLoginAttempts < maxAttempts)
            return false;

        this.failedLoginAttempts = 0;
        this.lockoutEnd = now.plus(duration);
        return true;
    }

    public void recordSuccessfulLogin(LocalDateTime now) {
        this.lastLoginAt = now;
        this.failedLoginAttempts = 0;
        this.lockoutEnd = null;
        this.updatedAt = now;
    }

    public void disable(LocalDateTime now) {
        this.status = UserStatus.DISABLED;
        this.updatedAt = now;
    }

    public void grant(UserRole role, LocalDateTime now) {
        this.roles.add(role);
        this.updatedAt = now;
    }
}
