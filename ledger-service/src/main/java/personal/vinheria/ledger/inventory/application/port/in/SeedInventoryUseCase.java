package personal.vinheria.ledger.inventory.application.port.in;

/**
 * 최초 기동 시 재고 초기 데이터 생성
 */
public interface SeedInventoryUseCase {

    /**
     * 상품 테이블이 비어 있을 때만 초기 상품을 등록한다.
     * @return 등록된 상품 수 (이미 데이터가 있으면 0)
     */
    int seedIfEmpty();
}
