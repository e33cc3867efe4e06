package personal.vinheria.ledger.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Ledger 설정 Properties
 * application.yml의 vinheria.* 설정을 바인딩
 */
@ConfigurationProperties(prefix = "vinheria")
public record LedgerProperties(
        Auth auth,
        Session session
) {
    public LedgerProperties {
        if (auth == null) {
            auth = new Auth(null);
        }
        if (session == null) {
            session = new Session(null, null, null, null, null);
        }
    }

    /**
     * @param accessToken 로그인 시 요구되는 공용 접근 토큰. 비어 있으면 모든 로그인이 거부된다.
     */
    public record Auth(
            String accessToken
    ) {
        public boolean accessTokenConfigured() {
            return accessToken != null && !accessToken.isBlank();
        }
    }

    /**
     * @param secret     세션 쿠키 서명 키
     * @param ttl        세션 유효 기간 (고정 TTL, 조회 시 연장되지 않음)
     * @param cookieName 세션 쿠키 이름
     * @param loginPath  인증 실패 시 리다이렉트할 경로
     * @param cookieSecure 쿠키 Secure 속성 (HTTPS 배포 시 true)
     */
    public record Session(
            String secret,
            Duration ttl,
            String cookieName,
            String loginPath,
            Boolean cookieSecure
    ) {
        public static final String DEFAULT_SECRET = "troque-este-segredo";

        public Session {
            if (secret == null || secret.isBlank()) {
                secret = DEFAULT_SECRET;
            }
            if (ttl == null) {
                ttl = Duration.ofHours(1);
            }
            if (cookieName == null || cookieName.isBlank()) {
                cookieName = "VINHERIA_SESSION";
            }
            if (loginPath == null || loginPath.isBlank()) {
                loginPath = "/login";
            }
            if (cookieSecure == null) {
                cookieSecure = Boolean.FALSE;
            }
        }
    }
}
