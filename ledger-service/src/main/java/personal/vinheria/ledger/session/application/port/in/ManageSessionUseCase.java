package personal.vinheria.ledger.session.application.port.in;

import personal.vinheria.ledger.auth.domain.model.VerifiedIdentity;
import personal.vinheria.ledger.session.domain.model.SessionHandle;

/**
 * Manage Session UseCase (Input Port)
 * 세션 발급, 검증, 폐기
 */
public interface ManageSessionUseCase {

    /**
     * 검증된 사용자에게 새 세션 발급
     * @param identity 검증된 사용자
     * @return 이후 요청에서 제시할 세션 핸들
     */
    SessionHandle create(VerifiedIdentity identity);

    /**
     * 세션 검증. 만료 시각은 연장하지 않는다.
     * @param handle 세션 핸들 (null 허용)
     * @return 세션에 바인딩된 사용자
     * @throws personal.vinheria.ledger.session.domain.exception.InvalidSessionException 핸들이 없거나, 알 수 없거나, 만료된 경우
     */
    VerifiedIdentity validate(SessionHandle handle);

    /**
     * 세션 폐기. 이미 폐기되었거나 알 수 없는 핸들이면 아무 일도 하지 않는다.
     * @param handle 세션 핸들 (null 허용)
     */
    void destroy(SessionHandle handle);
}
