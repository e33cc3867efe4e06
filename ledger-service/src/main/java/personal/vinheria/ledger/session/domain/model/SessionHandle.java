package personal.vinheria.ledger.session.domain.model;

/**
 * Session Handle
 * 세션을 식별하는 추측 불가능한 bearer 토큰. 로그에는 앞 8자리만 남긴다.
 */
public record SessionHandle(String value) {

    public SessionHandle {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Session handle cannot be null or blank");
        }
    }

    public String masked() {
        return value.length() <= 8 ? "****" : value.substring(0, 8) + "...";
    }

    @Override
    public String toString() {
        return "SessionHandle[" + masked() + "]";
    }
}
