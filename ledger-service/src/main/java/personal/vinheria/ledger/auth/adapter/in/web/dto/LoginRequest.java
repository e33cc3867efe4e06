package personal.vinheria.ledger.auth.adapter.in.web.dto;

import personal.vinheria.ledger.auth.application.port.in.LoginCommand;

/**
 * 로그인 요청 DTO
 * 누락된 값도 검증기에서 인증 실패로 처리되도록 Bean Validation을 걸지 않는다.
 */
public record LoginRequest(
        String email,
        String password,
        String accessToken
) {
    public LoginCommand toCommand() {
        return new LoginCommand(email, password, accessToken);
    }

    @Override
    public String toString() {
        return "LoginRequest[email=" + email + "]";
    }
}
