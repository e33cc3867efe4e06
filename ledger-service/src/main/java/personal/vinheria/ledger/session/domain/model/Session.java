package personal.vinheria.ledger.session.domain.model;

import personal.vinheria.ledger.auth.domain.model.VerifiedIdentity;

import java.time.Duration;
import java.time.Instant;

/**
 * Session Domain Model
 * 발급 시점부터 고정 TTL 동안만 유효하며, 조회로 만료 시각이 연장되지 않는다.
 */
public record Session(
        SessionHandle handle,
        VerifiedIdentity subject,
        Instant issuedAt,
        Instant expiresAt
) {
    public Session {
        if (handle == null || subject == null || issuedAt == null || expiresAt == null) {
            throw new IllegalArgumentException("Session fields cannot be null");
        }
        if (!expiresAt.isAfter(issuedAt)) {
            throw new IllegalArgumentException("expiresAt must be after issuedAt");
        }
    }

    public static Session issue(SessionHandle handle, VerifiedIdentity subject, Instant now, Duration ttl) {
        return new Session(handle, subject, now, now.plus(ttl));
    }

    /**
     * expiresAt 시각 이후(같은 시각 포함)는 만료로 본다.
     */
    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
