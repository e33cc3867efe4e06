package personal.vinheria.ledger.auth.application.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.vinheria.ledger.auth.application.port.in.LoginCommand;
import personal.vinheria.ledger.auth.application.port.in.VerifyLoginUseCase;
import personal.vinheria.ledger.auth.domain.exception.InvalidAccessTokenException;
import personal.vinheria.ledger.auth.domain.model.VerifiedIdentity;
import personal.vinheria.ledger.session.application.port.in.ManageSessionUseCase;
import personal.vinheria.ledger.session.domain.model.SessionHandle;
import personal.vinheria.ledger.support.TestProperties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("LoginService 단위 테스트")
class LoginServiceTest {

    @Mock
    private VerifyLoginUseCase verifyLoginUseCase;
    @Mock
    private ManageSessionUseCase manageSessionUseCase;

    private LoginService loginService;

    @BeforeEach
    void setUp() {
        loginService = new LoginService(verifyLoginUseCase, manageSessionUseCase, TestProperties.ledgerProperties());
    }

    @Test
    @DisplayName("로그인 성공 - 설정된 토큰으로 검증 후 세션 발급")
    void login_Success() {
        // given
        VerifiedIdentity identity = new VerifiedIdentity(1L, "a@x.com");
        SessionHandle handle = new SessionHandle("handle-0123456789");
        given(verifyLoginUseCase.verifyLogin("a@x.com", "pass1", "presented", TestProperties.ACCESS_TOKEN))
                .willReturn(identity);
        given(manageSessionUseCase.create(identity)).willReturn(handle);

        // when
        SessionHandle result = loginService.login(new LoginCommand("a@x.com", "pass1", "presented"));

        // then
        assertThat(result).isEqualTo(handle);
    }

    @Test
    @DisplayName("검증 실패 시 세션이 발급되지 않는다")
    void login_FailureIssuesNoSession() {
        // given
        given(verifyLoginUseCase.verifyLogin("a@x.com", "pass1", "wrong", TestProperties.ACCESS_TOKEN))
                .willThrow(new InvalidAccessTokenException("Access token mismatch"));

        // when & then
        assertThatThrownBy(() -> loginService.login(new LoginCommand("a@x.com", "pass1", "wrong")))
                .isInstanceOf(InvalidAccessTokenException.class);
        verify(manageSessionUseCase, never()).create(any());
    }

    @Test
    @DisplayName("로그아웃은 세션 폐기로 위임")
    void logout_DestroysSession() {
        SessionHandle handle = new SessionHandle("handle-0123456789");

        loginService.logout(handle);

        verify(manageSessionUseCase).destroy(handle);
    }
}
