package personal.vinheria.ledger.gate.adapter.in.web;

import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import personal.vinheria.common.web.ApiResponse;
import personal.vinheria.ledger.gate.application.GuardResult;
import personal.vinheria.ledger.session.adapter.in.web.SessionCookieManager;

import java.util.function.Function;

/**
 * GuardResult를 HTTP 응답으로 변환
 * 리다이렉트 결과는 302 + Location 헤더로 내려보내고 세션 쿠키를 지운다.
 */
@Component
@RequiredArgsConstructor
public class GatedResponses {

    static final String LOGIN_REQUIRED_MESSAGE = "로그인이 필요합니다.";

    private final SessionCookieManager sessionCookieManager;

    public <T, B> ResponseEntity<ApiResponse<B>> toResponse(
            GuardResult<T> result,
            HttpServletResponse servletResponse,
            Function<T, ResponseEntity<ApiResponse<B>>> onGranted) {
        return result.fold(onGranted, loginPath -> {
            sessionCookieManager.clear(servletResponse);
            return ResponseEntity.status(HttpStatus.FOUND)
                    .header(HttpHeaders.LOCATION, loginPath)
                    .body(ApiResponse.error(LOGIN_REQUIRED_MESSAGE, null));
        });
    }
}
