package personal.vinheria.ledger.user.domain.exception;

import personal.vinheria.common.exception.BusinessException;
import personal.vinheria.common.exception.ErrorCode;

/**
 * 가입 입력값(이메일, 비밀번호)이 유효하지 않을 때 발생
 */
public class InvalidRegistrationException extends BusinessException {

    public InvalidRegistrationException(String detail) {
        super(ErrorCode.INVALID_INPUT, detail);
    }
}
