package com.tokenvault.backend.auth.me.service;

import org.springframework.stereotype.Service;

import com.tokenvault.backend.auth.me.dto.MeResponse;
import com.tokenvault.backend.auth.user.User;
import com.tokenvault.backend.auth.user.UserDirectory;
import com.tokenvault.backend.global.ApiException;
import com.tokenvault.backend.global.ErrorCode;
import com.tokenvault.backend.security.AuthPrincipal;

import lombok.RequiredArgsConstructor;

/**
 * 현재 로그인 사용자 조회
 * - 토큰은 유효한데 유저가 삭제/비활성화된 경우 -> 401 (토큰을 더 믿지 않음)
 */
@Service
@RequiredArgsConstructor
public class MeService {

    private final UserDirectory userDirectory;

    public MeResponse me(AuthPrincipal principal) {
        if (principal == null)
            throw new ApiException(ErrorCode.AUTH_REQUIRED);

        User user = userDirectory.findById(principal.userId())
                .filter(User::isActive)
                .orElseThrow(() -> new ApiException(ErrorCode.ACCESS_INVALID));

        return new MeResponse(
                user.getId(),
                user.getUsername(),
                user.getEmail(),
                user.getFirstName(),
                user.getLastName(),
                userDirectory.getRoles(user),
                user.getLastLoginAt());
    }
}
