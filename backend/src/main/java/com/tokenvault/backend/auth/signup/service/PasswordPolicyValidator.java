package com.tokenvault.backend.auth.signup.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.springframework.stereotype.Component;

import com.tokenvault.backend.auth.config.AuthProperties;

import lombok.RequiredArgsConstructor;

/**
 * 가입 비밀번호 규칙 검사 (app.auth.password-policy)
 *
 * - 문자 종류: 대문자 / 소문자 / 숫자 / 특수문자 (각각 켜고 끌 수 있음)
 * - 흔한 비밀번호 목록과 정확히 일치하면 거절 (대소문자 무시)
 * - username 또는 이메일 @ 앞부분을 포함하면 거절 (대소문자 무시)
 * - 같은 문자가 maxRepeatedChars 번을 넘게 연속되면 거절
 *
 * 위반 사항을 전부 모아서 돌려준다. 빈 리스트면 통과.
 */
@Component
@RequiredArgsConstructor
public class PasswordPolicyValidator {

    static final Set<String> COMMON_PASSWORDS = Set.of(
            "password", "123456", "qwerty", "admin", "letmein", "welcome", "monkey", "dragon");

    private final AuthProperties props;

    public List<String> validate(String password, String username, String email) {
        AuthProperties.PasswordPolicy policy = props.passwordPolicy();
        List<String> violations = new ArrayList<>();

        if (password == null || password.isEmpty()) {
            violations.add("Password is required");
            return violations;
        }

        if (password.length() < policy.minLength())
            violations.add("Password must be at least " + policy.minLength() + " characters");
        if (policy.requireUppercase() && password.chars().noneMatch(Character::isUpperCase))
            violations.add("Password must contain an uppercase letter");
        if (policy.requireLowercase() && password.chars().noneMatch(Character::isLowerCase))
            violations.add("Password must contain a lowercase letter");
        if (policy.requireDigit() && password.chars().noneMatch(Character::isDigit))
            violations.add("Password must contain a digit");
        if (policy.requireSpecial() && password.chars().allMatch(Character::isLetterOrDigit))
            violations.add("Password must contain a special character");

        String lower = password.toLowerCase(Locale.ROOT);
        if (COMMON_PASSWORDS.contains(lower))
            violations.add("Password is too common");
        if (containsIgnoreCase(lower, username))
            violations.add("Password must not contain the username");
        if (email != null && email.indexOf('@') > 0
                && containsIgnoreCase(lower, email.substring(0, email.indexOf('@'))))
            violations.add("Password must not contain the email address");
        if (longestRun(password) > policy.maxRepeatedChars())
            violations.add("Password must not repeat a character more than "
                    + policy.maxRepeatedChars() + " times in a row");

        return violations;
    }

    private static boolean containsIgnoreCase(String lowerPassword, String part) {
        if (part == null || part.isBlank())
            return false;
        return lowerPassword.contains(part.trim().toLowerCase(Locale.ROOT));
    }

    static int longestRun(String s) {
        int longest = 0;
        int run = 0;
        for (int i = 0; i < s.length(); i++) {
            run = (i > 0 && s.charAt(i) == s.charAt(i - 1)) ? run + 1 : 1;
            longest = Math.max(longest, run);
        }
        return longest;
    }
}
