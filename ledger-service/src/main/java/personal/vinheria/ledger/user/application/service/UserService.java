package personal.vinheria.ledger.user.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.vinheria.ledger.user.application.port.in.FindUserUseCase;
import personal.vinheria.ledger.user.application.port.in.RegisterUserUseCase;
import personal.vinheria.ledger.user.application.port.out.PasswordHasher;
import personal.vinheria.ledger.user.application.port.out.UserRepository;
import personal.vinheria.ledger.user.domain.exception.DuplicateIdentityException;
import personal.vinheria.ledger.user.domain.exception.InvalidRegistrationException;
import personal.vinheria.ledger.user.domain.exception.UserNotFoundException;
import personal.vinheria.ledger.user.domain.model.User;

/**
 * User Application Service (Credential Store)
 * 사용자 등록과 조회를 담당. 사용자는 추가만 가능하며 수정/삭제하지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserService implements RegisterUserUseCase, FindUserUseCase {

    static final int MIN_PASSWORD_LENGTH = 4;

    private final UserRepository userRepository;
    private final PasswordHasher passwordHasher;

    /**
     * 해시 계산은 트랜잭션 밖에서 수행한다. 중복 여부는 저장 시점의 유니크 제약으로 최종 판정된다.
     */
    @Override
    public Long register(String email, String plaintextPassword) {
        String normalizedEmail = User.normalizeEmail(email);
        if (normalizedEmail.isEmpty()) {
            throw new InvalidRegistrationException("Email cannot be blank");
        }
        if (normalizedEmail.length() > User.MAX_EMAIL_LENGTH) {
            throw new InvalidRegistrationException(
                    String.format("Email must be at most %d characters", User.MAX_EMAIL_LENGTH));
        }
        if (plaintextPassword == null || plaintextPassword.length() < MIN_PASSWORD_LENGTH) {
            throw new InvalidRegistrationException(
                    String.format("Password must be at least %d characters", MIN_PASSWORD_LENGTH));
        }

        if (userRepository.existsByEmail(normalizedEmail)) {
            log.warn("Registration rejected, email already exists: email={}", normalizedEmail);
            throw new DuplicateIdentityException(normalizedEmail);
        }

        String passwordHash = passwordHasher.hash(plaintextPassword);
        User user = userRepository.create(normalizedEmail, passwordHash);

        log.info("User registered: userId={}, email={}", user.id(), user.email());
        return user.id();
    }

    @Override
    @Transactional(readOnly = true)
    public User findByEmail(String email) {
        String normalizedEmail = User.normalizeEmail(email);
        return userRepository.findByEmail(normalizedEmail)
                .orElseThrow(() -> {
                    log.debug("User not found by email");
                    return new UserNotFoundException(normalizedEmail);
                });
    }
}
