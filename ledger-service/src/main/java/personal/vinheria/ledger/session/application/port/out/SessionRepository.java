package personal.vinheria.ledger.session.application.port.out;

import personal.vinheria.ledger.session.domain.model.Session;
import personal.vinheria.ledger.session.domain.model.SessionHandle;

import java.time.Instant;
import java.util.Optional;

/**
 * Session Repository (Output Port)
 */
public interface SessionRepository {

    /**
     * 새 세션 저장
     * @return 같은 핸들의 세션이 이미 있으면 false
     */
    boolean saveIfAbsent(Session session);

    Optional<Session> findByHandle(SessionHandle handle);

    void delete(SessionHandle handle);

    /**
     * now 기준 만료된 세션 일괄 삭제
     * @return 삭제된 세션 수
     */
    int deleteExpired(Instant now);
}
