package personal.vinheria.ledger.acceptance.support;

import io.cucumber.spring.CucumberContextConfiguration;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

/**
 * Cucumber와 Spring Boot를 통합하기 위한 설정 클래스
 * test 프로파일의 인메모리 H2로 전체 애플리케이션을 띄운다.
 */
@CucumberContextConfiguration
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
@Import({LedgerHttpAdapter.class, LedgerTestAdapter.class, LedgerTestContext.class})
public class CucumberSpringConfiguration {
}
