package personal.vinheria.ledger.auth.application.port.in;

/**
 * 로그인 요청 Command
 */
public record LoginCommand(
        String email,
        String password,
        String accessToken
) {
    @Override
    public String toString() {
        return "LoginCommand[email=" + email + "]";
    }
}
