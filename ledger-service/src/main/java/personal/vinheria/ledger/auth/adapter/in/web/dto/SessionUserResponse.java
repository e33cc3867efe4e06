package personal.vinheria.ledger.auth.adapter.in.web.dto;

import personal.vinheria.ledger.auth.domain.model.VerifiedIdentity;

/**
 * 현재 세션 사용자 응답 DTO
 */
public record SessionUserResponse(
        Long userId,
        String email
) {
    public static SessionUserResponse from(VerifiedIdentity identity) {
        return new SessionUserResponse(identity.userId(), identity.email());
    }
}
