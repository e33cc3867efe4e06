package personal.vinheria.ledger.session.domain.service;

import org.springframework.stereotype.Component;
import personal.vinheria.ledger.session.domain.model.SessionHandle;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * 세션 핸들 생성기
 * 32바이트 난수를 Base64 URL-safe(패딩 없음)로 인코딩한다. 43자.
 */
@Component
public class SessionHandleGenerator {

    private static final int ENTROPY_BYTES = 32;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    public SessionHandle generate() {
        byte[] randomBytes = new byte[ENTROPY_BYTES];
        SECURE_RANDOM.nextBytes(randomBytes);
        return new SessionHandle(Base64.getUrlEncoder().withoutPadding().encodeToString(randomBytes));
    }
}
