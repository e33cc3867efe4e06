package personal.vinheria.ledger.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.stereotype.Component;

/**
 * 기동 시 설정 점검
 * 접근 토큰이 없으면 로그인 경로는 닫힌 상태로 동작하므로 서버는 띄우되 에러 로그를 남긴다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConfigurationValidator implements InitializingBean {

    private final LedgerProperties properties;

    @Override
    public void afterPropertiesSet() {
        if (!properties.auth().accessTokenConfigured()) {
            log.error("ACCESS_TOKEN is not configured. Every login attempt will be rejected.");
        }
        if (LedgerProperties.Session.DEFAULT_SECRET.equals(properties.session().secret())) {
            log.warn("SESSION_SECRET is not configured. Falling back to the default cookie signing key.");
        }
        if (properties.session().ttl().isNegative() || properties.session().ttl().isZero()) {
            throw new IllegalStateException("vinheria.session.ttl must be positive: " + properties.session().ttl());
        }
        log.info("Configuration validated: sessionTtl={}, loginPath={}",
                properties.session().ttl(), properties.session().loginPath());
    }
}
