package personal.vinheria.common.exception;

import org.springframework.http.HttpStatus;

/**
 * 에러 코드 정의
 * HTTP Status Code와 사용자에게 노출해도 안전한 메시지를 함께 관리
 */
public enum ErrorCode {
    // Common (Cxxx)
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "C001", "잘못된 입력값입니다."),
    NOT_FOUND(HttpStatus.NOT_FOUND, "C004", "요청한 리소스를 찾을 수 없습니다."),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "C006", "서버 내부 오류가 발생했습니다."),

    // User Domain (Uxxx)
    USER_NOT_FOUND(HttpStatus.NOT_FOUND, "U001", "사용자를 찾을 수 없습니다."),
    USER_ALREADY_EXISTS(HttpStatus.CONFLICT, "U002", "이미 가입된 이메일입니다."),
    // 알 수 없는 이메일과 비밀번호 불일치를 구분하지 않는다
    INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED, "U003", "인증 정보가 올바르지 않습니다."),

    // Auth / Session (Axxx)
    INVALID_ACCESS_TOKEN(HttpStatus.UNAUTHORIZED, "A001", "접근 토큰이 올바르지 않습니다."),
    INVALID_SESSION(HttpStatus.UNAUTHORIZED, "A002", "세션이 만료되었거나 유효하지 않습니다."),

    // Inventory Domain (Ixxx)
    PRODUCT_NOT_FOUND(HttpStatus.NOT_FOUND, "I001", "상품을 찾을 수 없습니다.");

    private final HttpStatus httpStatus;
    private final String code;
    private final String message;

    ErrorCode(HttpStatus httpStatus, String code, String message) {
        this.httpStatus = httpStatus;
        this.code = code;
        this.message = message;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
