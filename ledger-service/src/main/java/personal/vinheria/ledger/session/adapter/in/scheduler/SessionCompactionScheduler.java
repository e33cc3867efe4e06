package personal.vinheria.ledger.session.adapter.in.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import personal.vinheria.ledger.session.application.port.in.PurgeExpiredSessionsUseCase;

/**
 * Session Compaction Scheduler (Driving Adapter)
 * 만료 세션을 주기적으로 정리하여 세션 테이블이 무한히 커지지 않도록 한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionCompactionScheduler {

    private final PurgeExpiredSessionsUseCase purgeExpiredSessionsUseCase;

    @Scheduled(fixedDelayString = "${vinheria.session.cleanup-interval-ms:60000}")
    public void compact() {
        int purged = purgeExpiredSessionsUseCase.purgeExpiredSessions();
        if (purged > 0) {
            log.info("Session compaction completed. Purged: {}", purged);
        }
    }
}
