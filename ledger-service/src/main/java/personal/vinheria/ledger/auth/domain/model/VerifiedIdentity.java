package personal.vinheria.ledger.auth.domain.model;

/**
 * 로그인 검증을 통과한 사용자 식별 정보
 * 세션에 값으로 복사되며, 이메일은 표시용 사본이다.
 *
 * @param userId 사용자 ID
 * @param email  정규화된 이메일
 */
public record VerifiedIdentity(
        Long userId,
        String email
) {
    public VerifiedIdentity {
        if (userId == null) {
            throw new IllegalArgumentException("userId cannot be null");
        }
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("email cannot be null or blank");
        }
    }
}
