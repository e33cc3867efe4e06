package personal.vinheria.ledger.session.application.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.vinheria.ledger.auth.domain.model.VerifiedIdentity;
import personal.vinheria.ledger.config.LedgerProperties;
import personal.vinheria.ledger.session.application.port.in.ManageSessionUseCase;
import personal.vinheria.ledger.session.application.port.in.PurgeExpiredSessionsUseCase;
import personal.vinheria.ledger.session.application.port.out.SessionRepository;
import personal.vinheria.ledger.session.domain.exception.InvalidSessionException;
import personal.vinheria.ledger.session.domain.model.Session;
import personal.vinheria.ledger.session.domain.model.SessionHandle;
import personal.vinheria.ledger.session.domain.service.SessionHandleGenerator;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Session Manager
 * 고정 TTL 세션을 발급/검증/폐기한다. 만료 여부는 매 검증마다 확인하므로
 * 백그라운드 정리 작업이 없어도 만료 세션은 통과하지 못한다.
 */
@Slf4j
@Service
public class SessionManager implements ManageSessionUseCase, PurgeExpiredSessionsUseCase {

    // 32바이트 난수 충돌은 사실상 불가능하지만, 저장소가 거부하면 재발급한다.
    private static final int MAX_ISSUE_ATTEMPTS = 3;

    private final SessionRepository sessionRepository;
    private final SessionHandleGenerator handleGenerator;
    private final Clock clock;
    private final Duration ttl;

    public SessionManager(SessionRepository sessionRepository,
                          SessionHandleGenerator handleGenerator,
                          Clock clock,
                          LedgerProperties properties) {
        this.sessionRepository = sessionRepository;
        this.handleGenerator = handleGenerator;
        this.clock = clock;
        this.ttl = properties.session().ttl();
    }

    @Override
    public SessionHandle create(VerifiedIdentity identity) {
        Instant now = clock.instant();
        for (int attempt = 1; attempt <= MAX_ISSUE_ATTEMPTS; attempt++) {
            Session session = Session.issue(handleGenerator.generate(), identity, now, ttl);
            if (sessionRepository.saveIfAbsent(session)) {
                log.info("Session created: userId={}, handle={}, expiresAt={}",
                        identity.userId(), session.handle().masked(), session.expiresAt());
                return session.handle();
            }
            log.warn("Session handle collision, regenerating: attempt={}", attempt);
        }
        throw new IllegalStateException("Failed to allocate a unique session handle");
    }

    @Override
    public VerifiedIdentity validate(SessionHandle handle) {
        if (handle == null) {
            throw new InvalidSessionException("Session handle is absent");
        }

        Session session = sessionRepository.findByHandle(handle)
                .orElseThrow(() -> new InvalidSessionException("Unknown session: handle=" + handle.masked()));

        if (session.isExpiredAt(clock.instant())) {
            sessionRepository.delete(handle);
            log.debug("Expired session removed on validation: handle={}", handle.masked());
            throw new InvalidSessionException("Session expired: handle=" + handle.masked());
        }

        return session.subject();
    }

    @Override
    public void destroy(SessionHandle handle) {
        if (handle == null) {
            return;
        }
        sessionRepository.delete(handle);
        log.info("Session destroyed: handle={}", handle.masked());
    }

    @Override
    public int purgeExpiredSessions() {
        return sessionRepository.deleteExpired(clock.instant());
    }
}
