package personal.vinheria.ledger.inventory.domain.exception;

import personal.vinheria.common.exception.BusinessException;
import personal.vinheria.common.exception.ErrorCode;

/**
 * Product Not Found Exception
 * 증가/감소 대상 상품이 없을 때 발생 (삭제는 해당 없음)
 */
public class ProductNotFoundException extends BusinessException {
    public ProductNotFoundException(Long productId) {
        super(ErrorCode.PRODUCT_NOT_FOUND, String.format("Product not found: productId=%d", productId));
    }
}
