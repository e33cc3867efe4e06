package personal.vinheria.ledger.user.domain.model;

import personal.vinheria.common.exception.BusinessException;
import personal.vinheria.common.exception.ErrorCode;

import java.util.Locale;

/**
 * User Domain Model
 * 가입 이후 변경되지 않는 사용자 자격 증명
 *
 * @param id           사용자 ID (생성 시 할당, 불변)
 * @param email        정규화된 이메일 (trim + 소문자)
 * @param passwordHash 솔트가 포함된 단방향 해시. 평문 비밀번호는 저장하지 않는다.
 */
public record User(
        Long id,
        String email,
        String passwordHash
) {
    public User {
        if (id == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "User ID cannot be null");
        }
        if (email == null || email.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "User email cannot be null or blank");
        }
        if (passwordHash == null || passwordHash.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "User password hash cannot be null or blank");
        }
    }

    /**
     * users.email 컬럼 길이
     */
    public static final int MAX_EMAIL_LENGTH = 255;

    /**
     * 이메일 정규화 (null은 빈 문자열로 취급)
     */
    public static String normalizeEmail(String email) {
        return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * 비밀번호 해시가 노출되지 않도록 toString을 재정의
     */
    @Override
    public String toString() {
        return "User[id=" + id + ", email=" + email + "]";
    }
}
