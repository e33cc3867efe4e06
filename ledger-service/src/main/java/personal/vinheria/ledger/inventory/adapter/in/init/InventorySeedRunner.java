package personal.vinheria.ledger.inventory.adapter.in.init;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import personal.vinheria.ledger.inventory.application.port.in.SeedInventoryUseCase;

/**
 * Inventory Seed Runner (Driving Adapter)
 * 기동 시 1회 실행. 상품 테이블이 비어 있을 때만 초기 데이터를 넣는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InventorySeedRunner implements ApplicationRunner {

    private final SeedInventoryUseCase seedInventoryUseCase;

    @Override
    public void run(ApplicationArguments args) {
        int seeded = seedInventoryUseCase.seedIfEmpty();
        log.info("Inventory bootstrap finished: seeded={}", seeded);
    }
}
