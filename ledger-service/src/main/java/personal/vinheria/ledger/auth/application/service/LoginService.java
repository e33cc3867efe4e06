package personal.vinheria.ledger.auth.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.vinheria.ledger.auth.application.port.in.LoginCommand;
import personal.vinheria.ledger.auth.application.port.in.LoginUseCase;
import personal.vinheria.ledger.auth.application.port.in.VerifyLoginUseCase;
import personal.vinheria.ledger.auth.domain.model.VerifiedIdentity;
import personal.vinheria.ledger.config.LedgerProperties;
import personal.vinheria.ledger.session.application.port.in.ManageSessionUseCase;
import personal.vinheria.ledger.session.domain.model.SessionHandle;

/**
 * Login Application Service
 * Credential Verifier → Session Manager. 검증에 실패하면 세션은 발급되지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LoginService implements LoginUseCase {

    private final VerifyLoginUseCase verifyLoginUseCase;
    private final ManageSessionUseCase manageSessionUseCase;
    private final LedgerProperties properties;

    @Override
    public SessionHandle login(LoginCommand command) {
        VerifiedIdentity identity = verifyLoginUseCase.verifyLogin(
                command.email(),
                command.password(),
                command.accessToken(),
                properties.auth().accessToken());

        SessionHandle handle = manageSessionUseCase.create(identity);
        log.info("User logged in: userId={}", identity.userId());
        return handle;
    }

    @Override
    public void logout(SessionHandle handle) {
        manageSessionUseCase.destroy(handle);
    }
}
