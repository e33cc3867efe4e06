package personal.vinheria.common.health;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.sql.Connection;

/**
 * Health Check 공통 유틸리티 서비스
 */
@Slf4j
@Service
public class HealthCheckService {

    public static final String UP = "UP";
    public static final String DOWN = "DOWN";

    /**
     * 데이터베이스 연결 상태 확인
     *
     * @param dataSource the DataSource to check
     * @return "UP" if database is reachable, "DOWN" otherwise
     */
    public String checkDatabase(DataSource dataSource) {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(1) ? UP : DOWN;
        } catch (Exception e) {
            log.error("Database health check failed", e);
            return DOWN;
        }
    }
}
