package com.tokenvault.backend.auth.token.domain;

import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * [refresh_tokens 테이블 매핑 엔티티]
 *
 * 이 엔티티는 "로그인 세션 체인의 한 마디"에 해당한다.
 * - Access Token(JWT)은 서버에 저장하지 않음(Stateless)
 * - Refresh Token은 서버가 통제해야 안전함 -> DB에 저장하고 회전(rotation)할 때마다 새 row
 *
 * - PK = 토큰 값 자체 (고엔트로피 랜덤 문자열)
 * - jwtId: 같이 발급된 Access Token의 jti. 이 jti와 짝일 때만 유효하다.
 * - replacedByToken: 회전 시 다음 토큰 값을 가리킨다. 앞으로만 한 번 가리키므로 사이클이 없다.
 * - version: 낙관적 락. 같은 토큰에 대한 회전/폐기가 동시에 "둘 다 성공"하는 일을 막는다.
 *
 * 상태 변경은 revoke() / rotateTo() 뿐이고, 삭제는 만료 청소 작업(RefreshTokenSweeper)만 한다.
 *
 * @Index: idx_refresh_user_id (유저 기준 활성 세션 조회)
 * @Index: idx_refresh_jwt_id (jti 기준 조회)
 * @Index: idx_refresh_expires_at (만료 청소)
 */
@Getter
@Entity
@Table(name = "refresh_tokens", indexes = {
    @Index(name = "idx_refresh_user_id", columnList = "user_id, revoked"),
    @Index(name = "idx_refresh_jwt_id", columnList = "jwt_id"),
    @Index(name = "idx_refresh_expires_at", columnList = "expires_at")
})
@NoArgsConstructor(access = AccessLevel.PROTECTED) // JPA가 리플렉션으로 객체 생성
public class RefreshToken {

    @Id
    @Column(name = "token", nullable = false, updatable = false, length = 128)
    private String token;

    @Column(name = "jwt_id", nullable = false, length = 64)
    private String jwtId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;

    @Column(name = "revoked", nullable = false)
    private boolean revoked;

    // ========= 아래는 "운영/보안"을 위한 필드들 =============

    @Column(name = "revoked_at")
    private LocalDateTime revokedAt;

    @Column(name = "revoke_reason", length = 100)
    private String revokeReason;

    @Column(name = "created_by_ip", length = 45)
    private String createdByIp;

    @Column(name = "revoked_by_ip", length = 45)
    private String revokedByIp;

    @Column(name = "replaced_by_token", length = 128)
    private String replacedByToken;

    @Column(name = "device_info", length = 255)
    private String deviceInfo;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Column(name = "created_by", length = 64)
    private String createdBy;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;


    /**
     * 발급 팩토리 메서드 (RefreshTokenService 에서 호출됨)
     */
    public static RefreshToken issue(String token, String jwtId, Long userId,
                                     LocalDateTime now, LocalDateTime expiresAt,
                                     String createdByIp, String deviceInfo) {
        RefreshToken rt = new RefreshToken();
        rt.token = token;
        rt.jwtId = jwtId;
        rt.userId = userId;
        rt.expiresAt = expiresAt;
        rt.createdAt = now;
        rt.createdBy = String.valueOf(userId);
        rt.createdByIp = truncate(createdByIp, 45);
        rt.deviceInfo = truncate(deviceInfo, 255);
        return rt;
    }

    public boolean isExpired(LocalDateTime now) {return !expiresAt.isAfter(now);}
    public boolean isActive(LocalDateTime now) {return !revoked && !isExpired(now);}
    public boolean isRotated() {return revoked && replacedByToken != null;}

    public void revoke(LocalDateTime now, String ip, String reason) {
        this.revoked = true;
        this.revokedAt = now;
        this.revokedByIp = truncate(ip, 45);
        this.revokeReason = truncate(reason, 100);
        this.updatedAt = now;
    }

    /**
     * 회전: 이 토큰을 폐기하고 다음 토큰을 앞으로 가리킨다.
     */
    public void rotateTo(String nextToken, LocalDateTime now, String ip) {
        if (replacedByToken != null) {
            throw new IllegalStateException("refresh token already rotated");
        }
        revoke(now, ip, RefreshRevokeReason.ROTATED.name());
        this.replacedByToken = nextToken;
    }

    private static String truncate(String value, int max) {
        if (value == null)
            return null;
        return value.length() > max ? value.substring(0, max) : value;
    }
}
