package personal.vinheria.ledger.session.application.port.in;

/**
 * 만료된 세션 정리 유스케이스 (메모리 관리용)
 */
public interface PurgeExpiredSessionsUseCase {

    /**
     * @return 정리된 세션 수
     */
    int purgeExpiredSessions();
}
