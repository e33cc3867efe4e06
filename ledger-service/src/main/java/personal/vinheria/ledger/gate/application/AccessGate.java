package personal.vinheria.ledger.gate.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.vinheria.ledger.auth.domain.model.VerifiedIdentity;
import personal.vinheria.ledger.config.LedgerProperties;
import personal.vinheria.ledger.session.application.port.in.ManageSessionUseCase;
import personal.vinheria.ledger.session.domain.exception.InvalidSessionException;
import personal.vinheria.ledger.session.domain.model.SessionHandle;

import java.util.function.Function;

/**
 * Access Gate
 * 재고 조회/변경 작업을 세션 검증으로 감싼다. 검증 실패 시 작업은 호출되지 않고
 * 로그인 리다이렉트 결과를 돌려준다. 자체 상태는 없다.
 */
@Slf4j
@Component
public class AccessGate {

    private final ManageSessionUseCase manageSessionUseCase;
    private final String loginPath;

    public AccessGate(ManageSessionUseCase manageSessionUseCase, LedgerProperties properties) {
        this.manageSessionUseCase = manageSessionUseCase;
        this.loginPath = properties.session().loginPath();
    }

    public <T> GuardResult<T> guard(SessionHandle handle, Function<VerifiedIdentity, T> operation) {
        VerifiedIdentity identity;
        try {
            identity = manageSessionUseCase.validate(handle);
        } catch (InvalidSessionException e) {
            log.debug("Access denied, redirecting to login: {}", e.getMessage());
            return GuardResult.redirectToLogin(loginPath);
        }
        return GuardResult.granted(operation.apply(identity));
    }
}
