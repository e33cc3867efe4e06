package personal.vinheria.ledger.auth.adapter.in.web.dto;

public record RegisterResponse(Long userId) {
}
