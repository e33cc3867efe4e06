package personal.vinheria.ledger.inventory.application.port.out;

import personal.vinheria.ledger.inventory.domain.model.Product;

import java.util.List;

/**
 * Product Repository (Output Port)
 */
public interface ProductRepository {

    List<Product> findAllOrderById();

    Product create(String name, int quantity);

    /**
     * quantity = quantity + 1 (단일 UPDATE 문)
     * @return 영향받은 행 수 (0이면 상품 없음)
     */
    int incrementQuantity(Long productId);

    /**
     * quantity = max(quantity - 1, 0) (단일 UPDATE 문)
     * @return 매칭된 행 수 (0이면 상품 없음)
     */
    int decrementQuantity(Long productId);

    /**
     * @return 삭제된 행 수
     */
    int deleteById(Long productId);

    long count();
}
