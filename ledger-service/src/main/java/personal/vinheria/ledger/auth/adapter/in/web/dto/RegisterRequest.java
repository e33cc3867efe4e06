package personal.vinheria.ledger.auth.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * 가입 요청 DTO
 */
public record RegisterRequest(
        @NotBlank(message = "이메일은 필수입니다.")
        String email,

        @NotBlank(message = "비밀번호는 필수입니다.")
        String password
) {
    @Override
    public String toString() {
        return "RegisterRequest[email=" + email + "]";
    }
}
