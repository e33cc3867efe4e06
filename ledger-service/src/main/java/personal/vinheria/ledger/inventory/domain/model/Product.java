package personal.vinheria.ledger.inventory.domain.model;

import personal.vinheria.common.exception.BusinessException;
import personal.vinheria.common.exception.ErrorCode;

/**
 * Product Domain Model
 * 재고 수량은 어떤 변경 이후에도 음수가 될 수 없다.
 *
 * @param id       상품 ID (생성 순서대로 증가)
 * @param name     표시 이름
 * @param quantity 재고 수량 (0 이상)
 */
public record Product(
        Long id,
        String name,
        int quantity
) {
    public Product {
        if (id == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Product ID cannot be null");
        }
        if (name == null || name.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Product name cannot be null or blank");
        }
        if (quantity < 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Product quantity cannot be negative: id=%d, quantity=%d", id, quantity));
        }
    }
}
