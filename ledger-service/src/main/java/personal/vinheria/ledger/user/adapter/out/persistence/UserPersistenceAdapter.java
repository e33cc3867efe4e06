package personal.vinheria.ledger.user.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.hibernate.exception.ConstraintViolationException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import personal.vinheria.ledger.user.application.port.out.UserRepository;
import personal.vinheria.ledger.user.domain.exception.DuplicateIdentityException;
import personal.vinheria.ledger.user.domain.model.User;

import java.util.Locale;
import java.util.Optional;

/**
 * User Persistence Adapter
 * JPA를 사용한 사용자 저장소 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UserPersistenceAdapter implements UserRepository {

    private static final String EMAIL_UNIQUE_CONSTRAINT = "uk_users_email";
    // H2/PostgreSQL unique_violation, MySQL ER_DUP_ENTRY
    private static final String SQL_STATE_UNIQUE_VIOLATION = "23505";
    private static final int MYSQL_DUPLICATE_ENTRY = 1062;

    private final JpaUserRepository jpaUserRepository;

    @Override
    public Optional<User> findByEmail(String email) {
        log.debug("Finding user by email: {}", email);
        return jpaUserRepository.findByEmail(email)
                .map(UserEntity::toDomain);
    }

    @Override
    public boolean existsByEmail(String email) {
        return jpaUserRepository.existsByEmail(email);
    }

    /**
     * 동시 가입으로 사전 중복 검사를 통과한 경우에도 이메일 유니크 제약 위반을 타입 예외로 변환한다.
     * 그 밖의 무결성 오류(길이 초과 등)는 그대로 전파한다.
     */
    @Override
    public User create(String email, String passwordHash) {
        log.debug("Creating user: email={}", email);
        try {
            UserEntity saved = jpaUserRepository.saveAndFlush(UserEntity.of(email, passwordHash));
            return saved.toDomain();
        } catch (DataIntegrityViolationException e) {
            if (isEmailUniqueViolation(e)) {
                throw new DuplicateIdentityException(email, e);
            }
            throw e;
        }
    }

    private boolean isEmailUniqueViolation(DataIntegrityViolationException e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof ConstraintViolationException) {
                ConstraintViolationException violation = (ConstraintViolationException) cause;
                String constraintName = violation.getConstraintName();
                if (constraintName != null
                        && constraintName.toLowerCase(Locale.ROOT).contains(EMAIL_UNIQUE_CONSTRAINT)) {
                    return true;
                }
                return SQL_STATE_UNIQUE_VIOLATION.equals(violation.getSQLState())
                        || violation.getErrorCode() == MYSQL_DUPLICATE_ENTRY;
            }
        }
        return false;
    }
}
