package com.tokenvault.backend.security;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

import com.tokenvault.backend.auth.revocation.RevocationCache;

import lombok.RequiredArgsConstructor;

/**
 * Spring Security 전역 보안 설정
 *
 * - 모든 HTTP 요청은 @Controller에 도달하기 전에 Security Filter Chain을 먼저 통과
 * - 세션/쿠키를 쓰지 않는 Bearer 토큰 방식 -> CSRF / formLogin / httpBasic 끔, STATELESS
 * - JwtAuthenticationFilter 가 서명 검증 + 폐기 캐시 조회를 컨트롤러 이전에 끝낸다.
 */
@Configuration
@RequiredArgsConstructor
public class SecurityConfig {

    private final JwtService jwtService;
    private final RevocationCache revocationCache;
    private final SecurityErrorWriter errorWriter;

    @Bean
    SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        return http
                .csrf(csrf -> csrf.disable())
                .httpBasic(b -> b.disable())
                .formLogin(f -> f.disable())
                .logout(l -> l.disable()) // /auth/logout 은 직접 구현한 컨트롤러가 처리
                .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))

                .exceptionHandling(eh -> eh
                        .authenticationEntryPoint(new RestAuthEntryPoint(errorWriter))
                )

                .addFilterBefore(
                        new JwtAuthenticationFilter(jwtService, revocationCache, errorWriter),
                        UsernamePasswordAuthenticationFilter.class
                )

                .authorizeHttpRequests(auth -> auth
                        .requestMatchers("/error").permitAll()

                        // 공개 auth 엔드포인트
                        .requestMatchers(HttpMethod.POST, "/auth/signup").permitAll()
                        .requestMatchers(HttpMethod.POST, "/auth/login").permitAll()
                        .requestMatchers(HttpMethod.POST, "/auth/refresh").permitAll()

                        // 나머지는 인증 필요 (/auth/me, /auth/logout, /auth/revoke 포함)
                        .anyRequest().authenticated()
                )
                .build();
    }
}
