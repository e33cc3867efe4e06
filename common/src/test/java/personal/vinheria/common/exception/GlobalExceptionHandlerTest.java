package personal.vinheria.common.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("GlobalExceptionHandler 테스트")
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    @DisplayName("BusinessException은 ErrorCode의 상태와 메시지로 변환되고 detail은 노출되지 않는다")
    void handleBusinessException() {
        // given
        BusinessException exception = new BusinessException(ErrorCode.USER_ALREADY_EXISTS, "email=a@x.com");

        // when
        ResponseEntity<ErrorResponse> response = handler.handleBusinessException(exception);

        // then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().code()).isEqualTo("U002");
        assertThat(response.getBody().message())
                .isEqualTo(ErrorCode.USER_ALREADY_EXISTS.getMessage())
                .doesNotContain("a@x.com");
    }

    @Test
    @DisplayName("예상하지 못한 예외는 500")
    void handleException() {
        ResponseEntity<ErrorResponse> response = handler.handleException(new IllegalStateException("boom"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().code()).isEqualTo(ErrorCode.INTERNAL_SERVER_ERROR.getCode());
    }
}
