package personal.vinheria.ledger.inventory.adapter.in.web.dto;

import personal.vinheria.ledger.inventory.domain.model.Product;

/**
 * 상품 조회 응답 DTO
 */
public record ProductResponse(
        Long id,
        String name,
        int quantity
) {
    public static ProductResponse from(Product product) {
        return new ProductResponse(product.id(), product.name(), product.quantity());
    }
}
