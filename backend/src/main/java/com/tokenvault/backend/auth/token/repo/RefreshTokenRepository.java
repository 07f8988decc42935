package com.tokenvault.backend.auth.token.repo;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.tokenvault.backend.auth.token.domain.RefreshToken;

import jakarta.persistence.LockModeType;

public interface RefreshTokenRepository extends JpaRepository<RefreshToken, String> {

    /** 토큰 row 잠금 조회 (회전/폐기 직렬화) */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select t from RefreshToken t where t.token = :token")
    Optional<RefreshToken> findByTokenForUpdate(@Param("token") String token);

    /**
     * 유저의 활성 토큰 (오래된 순, 잠금)
     * - 세션 제한/전체 폐기에서 사용. 유저 row 잠금 이후에 호출된다.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
            select t from RefreshToken t
            where t.userId = :userId and t.revoked = false and t.expiresAt > :now
            order by t.createdAt asc
            """)
    List<RefreshToken> findActiveByUserIdForUpdate(@Param("userId") Long userId, @Param("now") LocalDateTime now);

    @Query("""
            select count(t) from RefreshToken t
            where t.userId = :userId and t.revoked = false and t.expiresAt > :now
            """)
    long countActiveByUserId(@Param("userId") Long userId, @Param("now") LocalDateTime now);

    List<RefreshToken> findByUserIdOrderByCreatedAtAsc(Long userId);

    Optional<RefreshToken> findByJwtId(String jwtId);

    /** 캐시 워밍업: 짝이 되는 Access Token이 아직 살아있을 수 있는 폐기 토큰 */
    @Query("""
            select t from RefreshToken t
            where t.revoked = true and t.createdAt > :issuedAfter
              and (t.revokeReason is null or t.revokeReason <> 'ROTATED')
            """)
    List<RefreshToken> findRevokedIssuedAfter(@Param("issuedAfter") LocalDateTime issuedAfter);

    @Modifying
    @Query("delete from RefreshToken t where t.expiresAt < :cutoff")
    int deleteExpiredBefore(@Param("cutoff") LocalDateTime cutoff);

    @Modifying
    @Query("delete from RefreshToken t where t.revoked = true and t.revokedAt < :cutoff")
    int deleteRevokedBefore(@Param("cutoff") LocalDateTime cutoff);
}
