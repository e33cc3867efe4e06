package personal.vinheria.ledger.session.adapter.in.web;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;
import org.springframework.web.util.WebUtils;
import personal.vinheria.ledger.config.LedgerProperties;
import personal.vinheria.ledger.session.domain.model.SessionHandle;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Duration;
import java.util.Base64;

/**
 * 세션 쿠키 관리
 * 쿠키 값은 "handle.signature" 형식이며 서명은 SESSION_SECRET 기반 HMAC-SHA256이다.
 * 서명이 맞지 않는 쿠키는 없는 것으로 취급한다.
 */
@Slf4j
@Component
public class SessionCookieManager {

    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final char SEPARATOR = '.';
    private static final String COOKIE_PATH = "/";
    private static final String SAME_SITE_LAX = "Lax";

    private final String cookieName;
    private final Duration maxAge;
    private final boolean secure;
    private final SecretKeySpec signingKey;

    public SessionCookieManager(LedgerProperties properties) {
        LedgerProperties.Session session = properties.session();
        this.cookieName = session.cookieName();
        this.maxAge = session.ttl();
        this.secure = session.cookieSecure();
        this.signingKey = new SecretKeySpec(session.secret().getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM);
    }

    /**
     * 요청 쿠키에서 서명이 검증된 세션 핸들을 꺼낸다.
     *
     * @return 핸들, 쿠키가 없거나 서명이 맞지 않으면 null
     */
    public SessionHandle resolve(HttpServletRequest request) {
        Cookie cookie = WebUtils.getCookie(request, cookieName);
        if (cookie == null) {
            return null;
        }
        return unsign(cookie.getValue());
    }

    public void write(HttpServletResponse response, SessionHandle handle) {
        ResponseCookie cookie = baseCookie(sign(handle))
                .maxAge(maxAge)
                .build();
        response.addHeader(HttpHeaders.SET_COOKIE, cookie.toString());
    }

    public void clear(HttpServletResponse response) {
        ResponseCookie cookie = baseCookie("")
                .maxAge(0)
                .build();
        response.addHeader(HttpHeaders.SET_COOKIE, cookie.toString());
    }

    public String sign(SessionHandle handle) {
        return handle.value() + SEPARATOR + signature(handle.value());
    }

    SessionHandle unsign(String cookieValue) {
        if (cookieValue == null) {
            return null;
        }
        int separatorIndex = cookieValue.lastIndexOf(SEPARATOR);
        if (separatorIndex <= 0 || separatorIndex == cookieValue.length() - 1) {
            return null;
        }

        String value = cookieValue.substring(0, separatorIndex);
        String presented = cookieValue.substring(separatorIndex + 1);
        boolean valid = MessageDigest.isEqual(
                signature(value).getBytes(StandardCharsets.US_ASCII),
                presented.getBytes(StandardCharsets.US_ASCII));
        if (!valid) {
            log.warn("Session cookie signature mismatch");
            return null;
        }
        return new SessionHandle(value);
    }

    private ResponseCookie.ResponseCookieBuilder baseCookie(String value) {
        return ResponseCookie.from(cookieName, value)
                .httpOnly(true)
                .secure(secure)
                .path(COOKIE_PATH)
                .sameSite(SAME_SITE_LAX);
    }

    private String signature(String value) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(signingKey);
            byte[] digest = mac.doFinal(value.getBytes(StandardCharsets.UTF_8));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(digest);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to compute session cookie signature", e);
        }
    }
}
