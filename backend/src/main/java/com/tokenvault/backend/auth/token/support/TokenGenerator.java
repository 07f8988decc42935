package com.tokenvault.backend.auth.token.support;

import java.security.SecureRandom;
import java.util.Base64;

import org.springframework.stereotype.Component;

import com.tokenvault.backend.auth.config.AuthProperties;

/**
 * Refresh Token 값 생성기 (불투명 토큰, DB PK 로 그대로 쓰인다)
 *
 * - app.auth.refresh.token-bytes 만큼 SecureRandom 바이트 -> Base64URL(패딩 없음)
 * - 기본 64바이트 = 86자. 인코딩 길이가 token 컬럼(128자)을 넘는 설정이면 기동 실패
 */
@Component
public class TokenGenerator {

    private final SecureRandom secureRandom;
    private final int tokenBytes;

    public TokenGenerator(SecureRandom secureRandom, AuthProperties props) {
        this.secureRandom = secureRandom;
        this.tokenBytes = props.refresh().tokenBytes();
        if (Base64.getUrlEncoder().withoutPadding().encodeToString(new byte[tokenBytes]).length() > 128) {
            throw new IllegalStateException("app.auth.refresh.token-bytes too large for token column: " + tokenBytes);
        }
    }

    public String generateRefreshToken() {
        byte[] bytes = new byte[tokenBytes];
        secureRandom.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
