package personal.vinheria.ledger.session.adapter.out.memory;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.vinheria.ledger.session.application.port.out.SessionRepository;
import personal.vinheria.ledger.session.domain.model.Session;
import personal.vinheria.ledger.session.domain.model.SessionHandle;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 프로세스 범위 세션 테이블
 * 세션의 원본 저장소이며, 프로세스 재시작 시 모든 세션이 사라진다.
 */
@Slf4j
@Component
public class InMemorySessionRepository implements SessionRepository {

    private final ConcurrentHashMap<String, Session> sessions = new ConcurrentHashMap<>();

    @Override
    public boolean saveIfAbsent(Session session) {
        return sessions.putIfAbsent(session.handle().value(), session) == null;
    }

    @Override
    public Optional<Session> findByHandle(SessionHandle handle) {
        return Optional.ofNullable(sessions.get(handle.value()));
    }

    @Override
    public void delete(SessionHandle handle) {
        sessions.remove(handle.value());
    }

    @Override
    public int deleteExpired(Instant now) {
        int removed = 0;
        for (Map.Entry<String, Session> entry : sessions.entrySet()) {
            if (entry.getValue().isExpiredAt(now) && sessions.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Expired sessions removed: count={}, remaining={}", removed, sessions.size());
        }
        return removed;
    }

    int size() {
        return sessions.size();
    }
}
