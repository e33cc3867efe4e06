package personal.vinheria.ledger.user.domain.exception;

import personal.vinheria.common.exception.BusinessException;
import personal.vinheria.common.exception.ErrorCode;

/**
 * Duplicate Identity Exception
 * 정규화된 이메일이 이미 가입되어 있을 때 발생
 */
public class DuplicateIdentityException extends BusinessException {

    public DuplicateIdentityException(String email) {
        super(ErrorCode.USER_ALREADY_EXISTS, String.format("User already exists: email=%s", email));
    }

    public DuplicateIdentityException(String email, Throwable cause) {
        super(ErrorCode.USER_ALREADY_EXISTS, String.format("User already exists: email=%s", email), cause);
    }
}
