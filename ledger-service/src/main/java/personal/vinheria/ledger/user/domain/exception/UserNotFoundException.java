package personal.vinheria.ledger.user.domain.exception;

import personal.vinheria.common.exception.BusinessException;
import personal.vinheria.common.exception.ErrorCode;

/**
 * User Not Found Exception
 * 사용자를 찾을 수 없을 때 발생하는 예외
 */
public class UserNotFoundException extends BusinessException {

    public UserNotFoundException(String email) {
        super(ErrorCode.USER_NOT_FOUND, String.format("User not found: email=%s", email));
    }
}
