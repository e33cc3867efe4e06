package personal.vinheria.ledger.inventory.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.vinheria.ledger.inventory.application.port.in.AddProductCommand;
import personal.vinheria.ledger.inventory.application.port.in.AddProductUseCase;
import personal.vinheria.ledger.inventory.application.port.in.AdjustStockUseCase;
import personal.vinheria.ledger.inventory.application.port.in.DeleteProductUseCase;
import personal.vinheria.ledger.inventory.application.port.in.ListProductsUseCase;
import personal.vinheria.ledger.inventory.application.port.in.SeedInventoryUseCase;
import personal.vinheria.ledger.inventory.application.port.out.ProductRepository;
import personal.vinheria.ledger.inventory.domain.exception.ProductNotFoundException;
import personal.vinheria.ledger.inventory.domain.model.Product;

import java.util.List;

/**
 * Inventory Ledger Application Service
 * 조회는 매번 저장소에서 읽고, 수량 변경은 읽기-후-쓰기 없이 원자적 UPDATE로 위임한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InventoryLedgerService implements ListProductsUseCase, AddProductUseCase,
        AdjustStockUseCase, DeleteProductUseCase, SeedInventoryUseCase {

    /**
     * 최초 기동 시 등록되는 상품 (등록 순서 유지)
     */
    static final List<SeedItem> SEED_ITEMS = List.of(
            new SeedItem("Tinto Reserva", 12),
            new SeedItem("Branco Seco", 8),
            new SeedItem("Rosé Suave", 5)
    );

    private final ProductRepository productRepository;

    @Override
    @Transactional(readOnly = true)
    public List<Product> listProducts() {
        return productRepository.findAllOrderById();
    }

    @Override
    @Transactional
    public Long addProduct(AddProductCommand command) {
        Product product = productRepository.create(command.name(), command.initialQuantity());
        log.info("Product added: productId={}, name={}, quantity={}",
                product.id(), product.name(), product.quantity());
        return product.id();
    }

    @Override
    @Transactional
    public void increment(Long productId) {
        int updated = productRepository.incrementQuantity(productId);
        if (updated == 0) {
            log.warn("Increment rejected, product not found: productId={}", productId);
            throw new ProductNotFoundException(productId);
        }
        log.debug("Product incremented: productId={}", productId);
    }

    @Override
    @Transactional
    public void decrement(Long productId) {
        int matched = productRepository.decrementQuantity(productId);
        if (matched == 0) {
            log.warn("Decrement rejected, product not found: productId={}", productId);
            throw new ProductNotFoundException(productId);
        }
        log.debug("Product decremented: productId={}", productId);
    }

    @Override
    @Transactional
    public void deleteProduct(Long productId) {
        int deleted = productRepository.deleteById(productId);
        log.info("Product delete requested: productId={}, deleted={}", productId, deleted);
    }

    @Override
    @Transactional
    public int seedIfEmpty() {
        if (productRepository.count() > 0) {
            log.debug("Inventory already populated, skipping seed");
            return 0;
        }
        SEED_ITEMS.forEach(item -> productRepository.create(item.name(), item.quantity()));
        log.info("Inventory seeded with {} products", SEED_ITEMS.size());
        return SEED_ITEMS.size();
    }

    record SeedItem(String name, int quantity) {
    }
}
