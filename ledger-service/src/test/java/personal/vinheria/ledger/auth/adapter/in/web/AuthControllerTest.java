package personal.vinheria.ledger.auth.adapter.in.web;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import personal.vinheria.ledger.auth.application.port.in.LoginCommand;
import personal.vinheria.ledger.auth.application.port.in.LoginUseCase;
import personal.vinheria.ledger.auth.domain.exception.InvalidAccessTokenException;
import personal.vinheria.ledger.auth.domain.exception.InvalidCredentialsException;
import personal.vinheria.ledger.config.LedgerProperties;
import personal.vinheria.ledger.gate.adapter.in.web.GatedResponses;
import personal.vinheria.ledger.gate.application.AccessGate;
import personal.vinheria.ledger.session.adapter.in.web.SessionCookieManager;
import personal.vinheria.ledger.session.application.port.in.ManageSessionUseCase;
import personal.vinheria.ledger.session.domain.model.SessionHandle;
import personal.vinheria.ledger.user.application.port.in.RegisterUserUseCase;
import personal.vinheria.ledger.user.domain.exception.DuplicateIdentityException;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Auth Controller 단위 테스트
 */
@WebMvcTest(AuthController.class)
@Import({AccessGate.class, GatedResponses.class, SessionCookieManager.class})
@EnableConfigurationProperties(LedgerProperties.class)
@DisplayName("Auth API 단위 테스트")
class AuthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RegisterUserUseCase registerUserUseCase;
    @MockBean
    private LoginUseCase loginUseCase;
    @MockBean
    private ManageSessionUseCase manageSessionUseCase;

    @Test
    @DisplayName("가입 성공 시 201과 사용자 id")
    void register_Success() throws Exception {
        // Given
        given(registerUserUseCase.register("a@x.com", "pass1")).willReturn(1L);

        // When & Then
        mockMvc.perform(post("/api/v1/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"a@x.com\",\"password\":\"pass1\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.userId").value(1));
    }

    @Test
    @DisplayName("중복 가입은 409, 응답에 이메일이 노출되지 않는다")
    void register_Duplicate() throws Exception {
        // Given
        given(registerUserUseCase.register("a@x.com", "pass1"))
                .willThrow(new DuplicateIdentityException("a@x.com"));

        // When & Then
        mockMvc.perform(post("/api/v1/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"a@x.com\",\"password\":\"pass1\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("U002"))
                .andExpect(jsonPath("$.message", not(containsString("a@x.com"))));
    }

    @Test
    @DisplayName("필수 값 누락 가입은 400")
    void register_MissingField() throws Exception {
        mockMvc.perform(post("/api/v1/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"a@x.com\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("C001"));
    }

    @Test
    @DisplayName("로그인 성공 시 서명된 HttpOnly 세션 쿠키 발급")
    void login_Success() throws Exception {
        // Given
        given(loginUseCase.login(any(LoginCommand.class)))
                .willReturn(new SessionHandle("AbCdEfGh_ijkl-mnop0123456789"));

        // When & Then
        mockMvc.perform(post("/api/v1/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"a@x.com\",\"password\":\"pass1\",\"accessToken\":\"t\"}"))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.SET_COOKIE,
                        containsString("VINHERIA_SESSION=AbCdEfGh_ijkl-mnop0123456789.")))
                .andExpect(header().string(HttpHeaders.SET_COOKIE, containsString("HttpOnly")));
    }

    @Test
    @DisplayName("접근 토큰 불일치는 401 A001, 쿠키 없음")
    void login_InvalidAccessToken() throws Exception {
        // Given
        given(loginUseCase.login(any(LoginCommand.class)))
                .willThrow(new InvalidAccessTokenException("Access token mismatch"));

        // When & Then
        mockMvc.perform(post("/api/v1/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"a@x.com\",\"password\":\"pass1\",\"accessToken\":\"wrong\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("A001"))
                .andExpect(header().doesNotExist(HttpHeaders.SET_COOKIE));
    }

    @Test
    @DisplayName("잘못된 자격 증명은 401 U003")
    void login_InvalidCredentials() throws Exception {
        given(loginUseCase.login(any(LoginCommand.class))).willThrow(new InvalidCredentialsException());

        mockMvc.perform(post("/api/v1/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"a@x.com\",\"password\":\"nope\",\"accessToken\":\"t\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("U003"));
    }

    @Test
    @DisplayName("로그아웃은 쿠키가 없어도 200")
    void logout_WithoutCookie() throws Exception {
        mockMvc.perform(post("/api/v1/auth/logout"))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.SET_COOKIE, containsString("Max-Age=0")));
        verify(loginUseCase).logout(null);
    }
}
