package personal.vinheria.ledger.auth.application.port.in;

import personal.vinheria.ledger.session.domain.model.SessionHandle;

/**
 * Login / Logout UseCase (Input Port)
 */
public interface LoginUseCase {

    /**
     * 설정된 접근 토큰으로 자격 증명을 검증하고 세션을 발급
     * @return 발급된 세션 핸들
     */
    SessionHandle login(LoginCommand command);

    /**
     * 세션 폐기 (멱등)
     */
    void logout(SessionHandle handle);
}
