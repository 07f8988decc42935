package com.tokenvault.backend.auth.user;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import lombok.RequiredArgsConstructor;

/**
 * users 테이블 + BCrypt 기반 UserDirectory 구현
 */
@Service
@RequiredArgsConstructor
public class JpaUserDirectory implements UserDirectory {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public Optional<User> findById(Long userId) {
        if (userId == null)
            return Optional.empty();
        return userRepository.findById(userId);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<User> findByName(String username) {
        if (username == null || username.isBlank())
            return Optional.empty();
        return userRepository.findByUsername(username.trim());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<User> findByEmail(String email) {
        if (email == null || email.isBlank())
            return Optional.empty();
        return userRepository.findByEmail(email.trim().toLowerCase());
    }

    @Override
    public boolean checkPassword(User user, String rawPassword) {
        if (user == null || rawPassword == null)
            return false;
        return passwordEncoder.matches(rawPassword, user.getPasswordHash());
    }

    @Override
    @Transactional
    public User update(User user) {
        return userRepository.save(user);
    }

    @Override
    public Set<String> getRoles(User user) {
        return user.getRoles().stream()
                .map(UserRole::name)
                .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    @Transactional
    public User register(String username, String email, String rawPassword, String firstName, String lastName) {
        User user = User.create(
                username.trim(),
                email.trim().toLowerCase(),
                passwordEncoder.encode(rawPassword),
                firstName,
                lastName,
                LocalDateTime.now(clock));
        return userRepository.save(user);
    }
}
