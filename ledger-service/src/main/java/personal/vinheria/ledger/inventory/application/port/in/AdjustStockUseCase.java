package personal.vinheria.ledger.inventory.application.port.in;

/**
 * Adjust Stock UseCase (Input Port)
 * 수량 변경은 저장소에서 단일 원자 연산으로 수행된다.
 */
public interface AdjustStockUseCase {

    /**
     * 수량 +1
     * @throws personal.vinheria.ledger.inventory.domain.exception.ProductNotFoundException 상품이 없을 때
     */
    void increment(Long productId);

    /**
     * 수량 -1, 0 미만으로 내려가지 않는다 (0이면 변화 없음)
     * @throws personal.vinheria.ledger.inventory.domain.exception.ProductNotFoundException 상품이 없을 때
     */
    void decrement(Long productId);
}
