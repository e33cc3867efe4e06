package personal.vinheria.ledger.auth.adapter.in.web;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.vinheria.common.web.ApiResponse;
import personal.vinheria.ledger.auth.adapter.in.web.dto.LoginRequest;
import personal.vinheria.ledger.auth.adapter.in.web.dto.RegisterRequest;
import personal.vinheria.ledger.auth.adapter.in.web.dto.RegisterResponse;
import personal.vinheria.ledger.auth.adapter.in.web.dto.SessionUserResponse;
import personal.vinheria.ledger.auth.application.port.in.LoginUseCase;
import personal.vinheria.ledger.gate.adapter.in.web.GatedResponses;
import personal.vinheria.ledger.gate.application.AccessGate;
import personal.vinheria.ledger.gate.application.GuardResult;
import personal.vinheria.ledger.session.adapter.in.web.SessionCookieManager;
import personal.vinheria.ledger.session.domain.model.SessionHandle;
import personal.vinheria.ledger.user.application.port.in.RegisterUserUseCase;

/**
 * Auth API Controller
 * 가입, 로그인(비밀번호 + 접근 토큰), 로그아웃
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/auth")
@RequiredArgsConstructor
public class AuthController {

    private final RegisterUserUseCase registerUserUseCase;
    private final LoginUseCase loginUseCase;
    private final AccessGate accessGate;
    private final SessionCookieManager sessionCookieManager;
    private final GatedResponses gatedResponses;

    /**
     * 가입
     * POST /api/v1/auth/register
     */
    @PostMapping("/register")
    public ResponseEntity<ApiResponse<RegisterResponse>> register(@Valid @RequestBody RegisterRequest request) {
        log.info("Register requested: email={}", request.email());

        Long userId = registerUserUseCase.register(request.email(), request.password());

        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("가입이 완료되었습니다. 로그인해 주세요.", new RegisterResponse(userId)));
    }

    /**
     * 로그인. 성공 시 서명된 세션 쿠키를 발급한다.
     * POST /api/v1/auth/login
     */
    @PostMapping("/login")
    public ResponseEntity<ApiResponse<Void>> login(@RequestBody LoginRequest request,
                                                   HttpServletResponse response) {
        log.info("Login requested: email={}", request.email());

        SessionHandle handle = loginUseCase.login(request.toCommand());
        sessionCookieManager.write(response, handle);

        return ResponseEntity.ok(ApiResponse.success("로그인되었습니다."));
    }

    /**
     * 로그아웃 (멱등)
     * POST /api/v1/auth/logout
     */
    @PostMapping("/logout")
    public ResponseEntity<ApiResponse<Void>> logout(HttpServletRequest request, HttpServletResponse response) {
        loginUseCase.logout(sessionCookieManager.resolve(request));
        sessionCookieManager.clear(response);
        return ResponseEntity.ok(ApiResponse.success("로그아웃되었습니다."));
    }

    /**
     * 현재 세션 사용자
     * GET /api/v1/auth/me
     */
    @GetMapping("/me")
    public ResponseEntity<ApiResponse<SessionUserResponse>> me(HttpServletRequest request,
                                                               HttpServletResponse response) {
        GuardResult<SessionUserResponse> result =
                accessGate.guard(sessionCookieManager.resolve(request), SessionUserResponse::from);
        return gatedResponses.toResponse(result, response,
                user -> ResponseEntity.ok(ApiResponse.success("현재 사용자", user)));
    }
}
