package com.tokenvault.backend.auth.signup.service;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.tokenvault.backend.auth.config.AuthProperties;
import com.tokenvault.backend.support.TestAuthProperties;

@DisplayName("[Signup] 비밀번호 정책")
class PasswordPolicyValidatorTest {

    private final PasswordPolicyValidator validator = new PasswordPolicyValidator(TestAuthProperties.defaults());

    @Test
    @DisplayName("모든 규칙을 만족하면 위반 없음")
    void strong_password_passes() {
        assertThat(validator.validate("Tr0ub4dor&3x", "frank", "frank@example.com")).isEmpty();
    }

    @Test
    @DisplayName("위반 사항은 한 번에 전부 모아서 돌려준다")
    void all_violations_are_collected() {
        assertThat(validator.validate("aaaa", "frank", "frank@example.com"))
                .hasSize(5)
                .anyMatch(v -> v.contains("at least 8"))
                .anyMatch(v -> v.contains("uppercase"))
                .anyMatch(v -> v.contains("digit"))
                .anyMatch(v -> v.contains("special"))
                .anyMatch(v -> v.contains("repeat"));
    }

    @Test
    @DisplayName("흔한 비밀번호 / username / 이메일 앞부분 포함은 대소문자 무시하고 거절")
    void identity_and_common_passwords_are_rejected() {
        assertThat(validator.validate("LetMeIn", "frank", "frank@example.com"))
                .anyMatch(v -> v.contains("too common"));
        assertThat(validator.validate("xFRANKx!1A", "frank", "other@example.com"))
                .containsExactly("Password must not contain the username");
        assertThat(validator.validate("Jones.99!x", "frank", "jones@example.com"))
                .containsExactly("Password must not contain the email address");
    }

    @Test
    @DisplayName("꺼진 규칙은 검사하지 않는다")
    void disabled_rules_are_skipped() {
        AuthProperties base = TestAuthProperties.defaults();
        AuthProperties relaxed = new AuthProperties(base.jwt(), base.refresh(), base.sweep(), base.revocation(),
                base.lockout(), new AuthProperties.PasswordPolicy(8, false, true, false, false, 2), base.audit());

        assertThat(new PasswordPolicyValidator(relaxed).validate("plainletters", "frank", "frank@example.com"))
                .isEmpty();
    }

    @Test
    @DisplayName("연속 반복 길이 계산")
    void longest_run() {
        assertThat(PasswordPolicyValidator.longestRun("abc")).isEqualTo(1);
        assertThat(PasswordPolicyValidator.longestRun("aabbb")).isEqualTo(3);
        assertThat(PasswordPolicyValidator.longestRun("")).isZero();
    }
}
