package personal.vinheria.ledger.inventory.application.port.in;

/**
 * Delete Product UseCase (Input Port)
 */
public interface DeleteProductUseCase {

    /**
     * 상품 삭제. 존재하지 않는 ID여도 예외 없이 종료한다.
     */
    void deleteProduct(Long productId);
}
