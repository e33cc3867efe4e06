package personal.vinheria.ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Ledger Service Application
 * 사용자 인증(비밀번호 + 공용 접근 토큰), 세션, 재고 원장을 담당하는 서비스
 */
@EnableScheduling  // 만료 세션 정리 스케줄러 활성화
@ConfigurationPropertiesScan
@SpringBootApplication(
    scanBasePackages = {
        "personal.vinheria.ledger",
        "personal.vinheria.common"  // common 모듈의 GlobalExceptionHandler 등을 스캔
    }
)
public class LedgerServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(LedgerServiceApplication.class, args);
    }
}
