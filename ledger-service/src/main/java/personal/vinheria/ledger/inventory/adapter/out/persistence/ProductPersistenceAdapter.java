package personal.vinheria.ledger.inventory.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.vinheria.ledger.inventory.application.port.out.ProductRepository;
import personal.vinheria.ledger.inventory.domain.model.Product;

import java.util.List;

/**
 * Product Persistence Adapter
 * JPA를 사용한 상품 저장소 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProductPersistenceAdapter implements ProductRepository {

    private final JpaProductRepository jpaProductRepository;

    @Override
    public List<Product> findAllOrderById() {
        log.debug("Finding all products");
        return jpaProductRepository.findAllByOrderByIdAsc()
                .stream()
                .map(ProductEntity::toDomain)
                .toList();
    }

    @Override
    public Product create(String name, int quantity) {
        log.debug("Creating product: name={}, quantity={}", name, quantity);
        return jpaProductRepository.save(ProductEntity.of(name, quantity)).toDomain();
    }

    @Override
    public int incrementQuantity(Long productId) {
        return jpaProductRepository.incrementQuantity(productId);
    }

    @Override
    public int decrementQuantity(Long productId) {
        return jpaProductRepository.decrementQuantity(productId);
    }

    @Override
    public int deleteById(Long productId) {
        return jpaProductRepository.deleteProductById(productId);
    }

    @Override
    public long count() {
        return jpaProductRepository.count();
    }
}
