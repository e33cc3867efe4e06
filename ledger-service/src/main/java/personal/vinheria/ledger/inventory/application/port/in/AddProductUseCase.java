package personal.vinheria.ledger.inventory.application.port.in;

/**
 * Add Product UseCase (Input Port)
 */
public interface AddProductUseCase {

    /**
     * @return 생성된 상품 ID
     */
    Long addProduct(AddProductCommand command);
}
