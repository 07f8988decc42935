package com.tokenvault.backend.auth.user;

import java.util.Optional;
import java.util.Set;

/**
 * 유저 저장소/비밀번호 검증 협력자
 *
 * - 토큰 라이프사이클 코어는 이 계약만 보고 동작한다. (저장 방식/해시 알고리즘은 모름)
 * - 없는 유저는 예외가 아니라 Optional.empty()
 */
public interface UserDirectory {

    Optional<User> findById(Long userId);

    Optional<User> findByName(String username);

    Optional<User> findByEmail(String email);

    boolean checkPassword(User user, String rawPassword);

    User update(User user);

    Set<String> getRoles(User user);

    User register(String username, String email, String rawPassword, String firstName, String lastName);
}
