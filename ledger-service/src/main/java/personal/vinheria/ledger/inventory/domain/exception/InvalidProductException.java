package personal.vinheria.ledger.inventory.domain.exception;

import personal.vinheria.common.exception.BusinessException;
import personal.vinheria.common.exception.ErrorCode;

public class InvalidProductException extends BusinessException {
    public InvalidProductException(String detail) {
        super(ErrorCode.INVALID_INPUT, detail);
    }
}
