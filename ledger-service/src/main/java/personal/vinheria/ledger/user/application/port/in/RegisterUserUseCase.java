package personal.vinheria.ledger.user.application.port.in;

/**
 * Register User UseCase (Input Port)
 * 사용자 가입 유스케이스
 */
public interface RegisterUserUseCase {

    /**
     * 이메일/비밀번호로 사용자 등록
     * @param email             가입 이메일 (정규화 전)
     * @param plaintextPassword 평문 비밀번호
     * @return 생성된 사용자 ID
     * @throws personal.vinheria.ledger.user.domain.exception.DuplicateIdentityException 정규화된 이메일이 이미 존재할 때
     * @throws personal.vinheria.ledger.user.domain.exception.InvalidRegistrationException 입력값이 유효하지 않을 때
     */
    Long register(String email, String plaintextPassword);
}
