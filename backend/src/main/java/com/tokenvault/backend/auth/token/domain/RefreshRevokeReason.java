package com.tokenvault.backend.auth.token.domain;

/**
 * RefreshToken이 폐기(revoke)된 이유
 *
 * - ROTATED: 정상적인 refresh rotation 과정에서 기존 토큰을 폐기한 경우 (replacedByToken 세팅됨)
 * - LOGOUT: 로그아웃으로 유저의 모든 세션을 종료한 경우
 * - MANUAL: 토큰 단건 폐기 요청 (사유 미지정)
 * - SESSION_LIMIT_EXCEEDED: 동시 세션 수 초과로 가장 오래된 세션이 밀려난 경우
 * - REUSE_DETECTED: 이미 회전된 토큰이 다시 제출되어 후손 체인을 통째로 폐기한 경우
 * - ALL_SESSIONS_REVOKED: 유저 전체 세션 폐기 (사유 미지정)
 */
public enum RefreshRevokeReason {
    ROTATED,
    LOGOUT,
    MANUAL,
    SESSION_LIMIT_EXCEEDED,
    REUSE_DETECTED,
    ALL_SESSIONS_REVOKED
}
