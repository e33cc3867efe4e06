package personal.vinheria.ledger.session.domain.exception;

import personal.vinheria.common.exception.BusinessException;
import personal.vinheria.common.exception.ErrorCode;

/**
 * 세션 핸들이 없거나, 알 수 없거나, 만료되었을 때 발생
 */
public class InvalidSessionException extends BusinessException {

    public InvalidSessionException(String detail) {
        super(ErrorCode.INVALID_SESSION, detail);
    }
}
