package personal.vinheria.ledger.auth.domain.exception;

import personal.vinheria.common.exception.BusinessException;
import personal.vinheria.common.exception.ErrorCode;

/**
 * Invalid Credentials Exception
 * 알 수 없는 이메일과 비밀번호 불일치 모두 이 예외 하나로 처리한다 (계정 존재 여부 비노출).
 */
public class InvalidCredentialsException extends BusinessException {

    public InvalidCredentialsException() {
        super(ErrorCode.INVALID_CREDENTIALS, "Invalid credentials");
    }
}
