package com.tokenvault.backend.auth.token.service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import com.tokenvault.backend.auth.audit.SecurityAudit;
import com.tokenvault.backend.auth.config.AuthProperties;
import com.tokenvault.backend.auth.token.domain.RefreshRevokeReason;
import com.tokenvault.backend.auth.token.domain.RefreshToken;
import com.tokenvault.backend.auth.token.repo.RefreshTokenRepository;
import com.tokenvault.backend.auth.token.service.RefreshTokensRevokedEvent.PairedAccessToken;
import com.tokenvault.backend.auth.token.support.TokenGenerator;
import com.tokenvault.backend.auth.user.UserRepository;
import com.tokenvault.backend.global.Result;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Refresh Token 라이프사이클 서비스
 *
 * 상태: Active -> Rotated | Revoked | Expired (전부 종착)
 * - create: 새 세션 발급 (+ 동시 세션 제한)
 * - validate: 토큰 + 짝 jti + userId 가 맞고 Active일 때만 통과
 * - rotate: old 폐기(ROTATED) + new 발급을 한 트랜잭션으로
 * - revoke / revokeAllForUser: 단건 / 유저 전체 폐기
 * - sweepExpired: 만료 후 유예 기간이 지난 row 삭제 (백그라운드 작업 전용)
 *
 * 실패 처리
 * - 예상 가능한 결과(없음, 이미 폐기, 경쟁에서 짐)는 Optional.empty() / Result.failure 로 돌려준다.
 * - 저장소 예외도 여기서 잡는다. 호출자에게 내부 예외를 흘리지 않음
 *
 * 동시성
 * - create / rotate / revokeAllForUser 는 유저 row를 먼저 잠근다. (같은 유저의 세션 변경 직렬화)
 * - rotate / revoke 는 토큰 row를 잠근다.
 * - 커밋 시점 충돌은 @Version 이 한 번 더 막는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RefreshTokenService {

    static final String TOKEN_NOT_FOUND = "Token not found";
    static final String USER_NOT_FOUND = "User not found";
    static final String REVOKE_ERROR = "Error revoking token";
    static final String REVOKE_ALL_ERROR = "Error revoking user tokens";

    private final RefreshTokenRepository repo;
    private final UserRepository userRepository;
    private final TokenGenerator tokenGenerator;
    private final TransactionTemplate tx;
    private final ApplicationEventPublisher events;
    private final SecurityAudit audit;
    private final AuthProperties props;
    private final Clock clock;

    /**
     * 새 Refresh Token 발급
     *
     * - jwtId: 같이 발급된 Access Token의 jti
     * - 동시 세션 제한: insert 이후 Active가 최대 N개가 되도록 가장 오래된 것부터 SESSION_LIMIT_EXCEEDED 로 폐기
     * - 유저가 없거나 저장 실패 -> Optional.empty()
     */
    public Optional<RefreshToken> create(Long userId, String jwtId, String ip, String deviceInfo) {
        if (userId == null || jwtId == null || jwtId.isBlank()) {
            log.warn("Refresh token creation rejected: userId or jwtId missing");
            return Optional.empty();
        }

        Issued issued;
        try {
            issued = tx.execute(status -> {
                if (userRepository.findByIdForUpdate(userId).isEmpty())
                    return null;
                return issueLocked(userId, jwtId, ip, deviceInfo, now());
            });
        } catch (RuntimeException e) {
            log.error("Error creating refresh token for user {}", userId, e);
            return Optional.empty();
        }

        if (issued == null) {
            log.warn("Refresh token creation rejected: user {} not found", userId);
            return Optional.empty();
        }

        auditEvictions(userId, issued.evicted(), ip);
        log.info("Created refresh token for user {} from IP {}", userId, ip);
        return Optional.of(issued.token());
    }

    /**
     * 검증: 존재 + jwtId 일치 + userId 일치 + Active
     *
     * 이미 회전된 토큰이 다시 들어오면(재사용) 실패시키고,
     * reuseDetection 이 켜져 있으면 그 토큰에서 이어진 후손 체인을 전부 REUSE_DETECTED 로 폐기한다.
     */
    public Optional<RefreshToken> validate(String token, String expectedJwtId, Long expectedUserId) {
        if (token == null || token.isBlank() || expectedJwtId == null || expectedUserId == null)
            return Optional.empty();

        try {
            Optional<RefreshToken> found = repo.findById(token);
            if (found.isEmpty()) {
                log.warn("Invalid refresh token attempted for user {}", expectedUserId);
                return Optional.empty();
            }

            RefreshToken rt = found.get();
            if (!rt.getUserId().equals(expectedUserId)) {
                log.warn("Refresh token mismatch for user {}", expectedUserId);
                return Optional.empty();
            }

            if (rt.isRotated()) {
                log.warn("Rotated refresh token reused for user {}", expectedUserId);
                if (props.refresh().reuseDetection())
                    revokeDescendants(rt);
                return Optional.empty();
            }

            if (!rt.getJwtId().equals(expectedJwtId)) {
                log.warn("Refresh token mismatch for user {}", expectedUserId);
                return Optional.empty();
            }

            if (rt.isRevoked()) {
                log.warn("Revoked refresh token used for user {}", expectedUserId);
                return Optional.empty();
            }

            if (rt.isExpired(now())) {
                log.warn("Expired refresh token used for user {}", expectedUserId);
                return Optional.empty();
            }

            return Optional.of(rt);
        } catch (RuntimeException e) {
            log.error("Error validating refresh token for user {}", expectedUserId, e);
            return Optional.empty();
        }
    }

    /**
     * 회전: old 를 ROTATED 로 폐기하고 replacedByToken 으로 새 토큰을 가리키게 한 뒤 새 토큰 발급
     *
     * - 한 트랜잭션: 둘 다 커밋되거나 둘 다 롤백
     * - 잠금 이후 다시 읽은 old 가 Active 가 아니거나 버전이 달라졌으면 경쟁에서 진 것 -> empty
     * - deviceInfo 를 안 주면 old 의 값을 이어받는다.
     */
    public Optional<RefreshToken> rotate(RefreshToken oldToken, String newJwtId, String ip, String deviceInfo) {
        if (oldToken == null || newJwtId == null || newJwtId.isBlank())
            return Optional.empty();

        Long userId = oldToken.getUserId();
        Issued issued;
        try {
            issued = tx.execute(status -> {
                if (userRepository.findByIdForUpdate(userId).isEmpty())
                    return null;

                LocalDateTime now = now();
                RefreshToken current = repo.findByTokenForUpdate(oldToken.getToken()).orElse(null);
                if (current == null
                        || !current.isActive(now)
                        || current.getReplacedByToken() != null
                        || !Objects.equals(current.getVersion(), oldToken.getVersion())) {
                    return null;
                }

                String nextDevice = deviceInfo != null ? deviceInfo : current.getDeviceInfo();
                String nextValue = tokenGenerator.generateRefreshToken();
                current.rotateTo(nextValue, now, ip);
                repo.saveAndFlush(current);

                return issueLocked(userId, newJwtId, ip, nextDevice, now, nextValue);
            });
        } catch (RuntimeException e) {
            log.error("Error rotating refresh token for user {}", userId, e);
            return Optional.empty();
        }

        if (issued == null) {
            log.warn("Refresh token rotation rejected for user {}: token no longer active", userId);
            return Optional.empty();
        }

        auditEvictions(userId, issued.evicted(), ip);
        log.info("Refreshed token for user {} from IP {}", userId, ip);
        return Optional.of(issued.token());
    }

    /**
     * 단건 폐기
     * - 없음 -> failure("Token not found")
     * - 이미 폐기됨 -> 성공 (멱등)
     * - reason 미지정 -> MANUAL
     */
    public Result revoke(String token, String ip, String reason) {
        if (token == null || token.isBlank())
            return Result.failure(TOKEN_NOT_FOUND);

        String effectiveReason = reason == null || reason.isBlank()
                ? RefreshRevokeReason.MANUAL.name()
                : reason;

        Revoked outcome;
        try {
            outcome = tx.execute(status -> {
                RefreshToken rt = repo.findByTokenForUpdate(token).orElse(null);
                if (rt == null)
                    return Revoked.notFound();
                if (rt.isRevoked())
                    return Revoked.none(rt.getUserId());

                rt.revoke(now(), ip, effectiveReason);
                publishRevoked(rt.getUserId(), List.of(rt), effectiveReason);
                return new Revoked(true, rt.getUserId(), List.of(rt));
            });
        } catch (RuntimeException e) {
            log.error("Error revoking token from IP {}", ip, e);
            return Result.failure(REVOKE_ERROR);
        }

        if (outcome == null || !outcome.found()) {
            log.warn("Attempted to revoke non-existent token from IP {}", ip);
            return Result.failure(TOKEN_NOT_FOUND);
        }
        if (outcome.tokens().isEmpty()) {
            log.debug("Refresh token of user {} already revoked", outcome.userId());
            return Result.ok();
        }

        log.info("Revoked token for user {} from IP {}. Reason: {}", outcome.userId(), ip, effectiveReason);
        audit.record(sink -> sink.tokenRevocation(token, ip, effectiveReason));
        return Result.ok();
    }

    /**
     * 유저의 Active 토큰 전부 폐기 (한 트랜잭션, 같은 유저의 create 와 직렬화)
     * - Active 가 없으면 그대로 성공
     * - 이미 만료됐지만 revoked=false 인 row는 건드리지 않는다. (어차피 쓸 수 없고 청소 대상)
     */
    public Result revokeAllForUser(Long userId, String ip, String reason) {
        if (userId == null)
            return Result.failure(USER_NOT_FOUND);

        String effectiveReason = reason == null || reason.isBlank()
                ? RefreshRevokeReason.ALL_SESSIONS_REVOKED.name()
                : reason;

        Revoked outcome;
        try {
            outcome = tx.execute(status -> {
                if (userRepository.findByIdForUpdate(userId).isEmpty())
                    return Revoked.notFound();

                LocalDateTime now = now();
                List<RefreshToken> active = repo.findActiveByUserIdForUpdate(userId, now);
                for (RefreshToken rt : active) {
                    rt.revoke(now, ip, effectiveReason);
                }
                if (!active.isEmpty())
                    publishRevoked(userId, active, effectiveReason);
                return new Revoked(true, userId, active);
            });
        } catch (RuntimeException e) {
            log.error("Error revoking all tokens for user {}", userId, e);
            return Result.failure(REVOKE_ALL_ERROR);
        }

        if (outcome == null || !outcome.found())
            return Result.failure(USER_NOT_FOUND);

        if (outcome.tokens().isEmpty()) {
            log.info("No active tokens found for user {}", userId);
        } else {
            log.info("Revoked {} tokens for user {} from IP {}. Reason: {}",
                    outcome.tokens().size(), userId, ip, effectiveReason);
        }
        return Result.ok();
    }

    /**
     * 청소: expiresAt 이 (now - 유예) 보다 오래된 row + 폐기된 지 보존 기간이 지난 row 삭제
     *
     * - 저장소 예외는 그대로 던진다. 재시도/백오프는 RefreshTokenSweeper(PeriodicBackgroundTask)의 몫
     */
    public int sweepExpired() {
        LocalDateTime now = now();
        LocalDateTime expiredCutoff = now.minusSeconds(props.sweep().expiredGraceSeconds());
        LocalDateTime revokedCutoff = now.minusSeconds(props.sweep().revokedRetentionSeconds());

        Integer deleted = tx.execute(status ->
                repo.deleteExpiredBefore(expiredCutoff) + repo.deleteRevokedBefore(revokedCutoff));
        int count = deleted == null ? 0 : deleted;
        if (count > 0)
            log.info("Cleaned up {} expired/revoked refresh tokens", count);
        return count;
    }

    // ======================= 내부 구현 =======================

    private Issued issueLocked(Long userId, String jwtId, String ip, String deviceInfo, LocalDateTime now) {
        return issueLocked(userId, jwtId, ip, deviceInfo, now, tokenGenerator.generateRefreshToken());
    }

    /**
     * 유저 row 잠금을 잡은 상태에서만 호출
     */
    private Issued issueLocked(Long userId, String jwtId, String ip, String deviceInfo,
                               LocalDateTime now, String value) {
        List<RefreshToken> evicted = enforceSessionLimit(userId, ip, now);

        RefreshToken token = RefreshToken.issue(
                value,
                jwtId,
                userId,
                now,
                now.plusSeconds(props.refresh().ttlSeconds()),
                ip,
                deviceInfo);
        repo.save(token);

        if (!evicted.isEmpty())
            publishRevoked(userId, evicted, RefreshRevokeReason.SESSION_LIMIT_EXCEEDED.name());
        return new Issued(token, evicted);
    }

    /**
     * 새 토큰이 들어갈 자리를 만든다: Active 가 (max - 1) 개가 될 때까지 오래된 순으로 폐기
     */
    private List<RefreshToken> enforceSessionLimit(Long userId, String ip, LocalDateTime now) {
        int max = props.refresh().maxConcurrentSessions();
        if (max <= 0)
            return List.of();

        List<RefreshToken> active = repo.findActiveByUserIdForUpdate(userId, now);
        int excess = active.size() - (max - 1);
        if (excess <= 0)
            return List.of();

        List<RefreshToken> evicted = new ArrayList<>(active.subList(0, excess));
        for (RefreshToken rt : evicted) {
            rt.revoke(now, ip, RefreshRevokeReason.SESSION_LIMIT_EXCEEDED.name());
        }
        log.info("Revoked {} oldest token(s) for user {} due to session limit", evicted.size(), userId);
        return evicted;
    }

    /**
     * 재사용 감지: 회전된 토큰에서 replacedByToken 을 따라가며 살아있는 후손을 전부 폐기
     * - 체인은 앞으로만 한 번씩 가리키지만 visited 로 한 번 더 막는다.
     */
    private void revokeDescendants(RefreshToken reused) {
        Long userId = reused.getUserId();
        List<RefreshToken> revoked;
        try {
            revoked = tx.execute(status -> {
                userRepository.findByIdForUpdate(userId);

                LocalDateTime now = now();
                List<RefreshToken> chain = new ArrayList<>();
                Set<String> visited = new HashSet<>();
                visited.add(reused.getToken());

                String next = reused.getReplacedByToken();
                while (next != null && visited.add(next)) {
                    RefreshToken rt = repo.findByTokenForUpdate(next).orElse(null);
                    if (rt == null)
                        break;
                    if (!rt.isRevoked()) {
                        rt.revoke(now, null, RefreshRevokeReason.REUSE_DETECTED.name());
                        chain.add(rt);
                    }
                    next = rt.getReplacedByToken();
                }

                if (!chain.isEmpty())
                    publishRevoked(userId, chain, RefreshRevokeReason.REUSE_DETECTED.name());
                return chain;
            });
        } catch (RuntimeException e) {
            log.error("Error revoking reused refresh token chain for user {}", userId, e);
            return;
        }

        int count = revoked == null ? 0 : revoked.size();
        log.warn("Refresh token reuse detected for user {}: revoked {} descendant token(s)", userId, count);
        audit.record(sink -> sink.securityViolation(
                String.valueOf(userId),
                "Refresh token reuse detected; revoked " + count + " descendant token(s)",
                null));
    }

    /**
     * 트랜잭션 안에서 발행 -> 리스너는 AFTER_COMMIT 에서 받는다. (롤백되면 캐시에도 안 들어감)
     */
    private void publishRevoked(Long userId, List<RefreshToken> tokens, String reason) {
        List<PairedAccessToken> paired = tokens.stream()
                .map(rt -> new PairedAccessToken(rt.getJwtId(), rt.getCreatedAt()))
                .toList();
        events.publishEvent(new RefreshTokensRevokedEvent(userId, paired, reason));
    }

    private void auditEvictions(Long userId, List<RefreshToken> evicted, String ip) {
        for (RefreshToken rt : evicted) {
            audit.record(sink -> sink.sessionEvicted(String.valueOf(userId), rt.getToken(), ip));
        }
    }

    // DB 컬럼(DATETIME(6)) 정밀도에 맞춘다
    private LocalDateTime now() {
        return LocalDateTime.now(clock).truncatedTo(ChronoUnit.MICROS);
    }

    private record Issued(RefreshToken token, List<RefreshToken> evicted) {}

    private record Revoked(boolean found, Long userId, List<RefreshToken> tokens) {
        static Revoked notFound() {
            return new Revoked(false, null, List.of());
        }

        static Revoked none(Long userId) {
            return new Revoked(true, userId, List.of());
        }
    }
}
