package personal.vinheria.ledger.adapter.in.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import personal.vinheria.common.health.HealthCheckService;
import personal.vinheria.common.web.ApiResponse;
import personal.vinheria.ledger.adapter.in.web.dto.HealthCheckResponse;

import javax.sql.DataSource;

/**
 * Health Check API Controller
 * 인증 없이 호출 가능한 상태 확인 엔드포인트
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class HealthCheckController {

    private final DataSource dataSource;
    private final HealthCheckService healthCheckService;

    @GetMapping("/health")
    public ResponseEntity<ApiResponse<HealthCheckResponse>> healthCheck() {
        log.debug("Health check requested");

        String databaseStatus = healthCheckService.checkDatabase(dataSource);
        HealthCheckResponse data = new HealthCheckResponse(databaseStatus);

        if (HealthCheckService.UP.equals(databaseStatus)) {
            return ResponseEntity.ok(ApiResponse.success("Application is healthy", data));
        }
        return ResponseEntity.ok(ApiResponse.error("Some components are unhealthy", data));
    }
}
