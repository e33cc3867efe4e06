package personal.vinheria.ledger.auth.domain.exception;

import personal.vinheria.common.exception.BusinessException;
import personal.vinheria.common.exception.ErrorCode;

/**
 * 접근 토큰이 없거나 설정값과 일치하지 않을 때 발생
 */
public class InvalidAccessTokenException extends BusinessException {

    public InvalidAccessTokenException(String detail) {
        super(ErrorCode.INVALID_ACCESS_TOKEN, detail);
    }
}
