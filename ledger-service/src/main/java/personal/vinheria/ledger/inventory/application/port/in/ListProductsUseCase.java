package personal.vinheria.ledger.inventory.application.port.in;

import personal.vinheria.ledger.inventory.domain.model.Product;

import java.util.List;

/**
 * List Products UseCase (Input Port)
 */
public interface ListProductsUseCase {

    /**
     * 전체 상품 목록 (ID 오름차순 = 생성 순서)
     */
    List<Product> listProducts();
}
