package personal.vinheria.ledger.auth.application.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.vinheria.ledger.auth.application.port.in.VerifyLoginUseCase;
import personal.vinheria.ledger.auth.domain.exception.InvalidAccessTokenException;
import personal.vinheria.ledger.auth.domain.exception.InvalidCredentialsException;
import personal.vinheria.ledger.auth.domain.model.VerifiedIdentity;
import personal.vinheria.ledger.user.application.port.in.FindUserUseCase;
import personal.vinheria.ledger.user.application.port.out.PasswordHasher;
import personal.vinheria.ledger.user.domain.exception.UserNotFoundException;
import personal.vinheria.ledger.user.domain.model.User;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Credential Verifier
 * 1) 접근 토큰 검사 (사용자 저장소 조회 전)
 * 2) 이메일 조회 + 비밀번호 해시 비교
 */
@Slf4j
@Service
public class CredentialVerifier implements VerifyLoginUseCase {

    private final FindUserUseCase findUserUseCase;
    private final PasswordHasher passwordHasher;
    // 존재하지 않는 이메일에도 해시 비교 비용을 동일하게 치르기 위한 더미 해시
    private final String dummyHash;

    public CredentialVerifier(FindUserUseCase findUserUseCase, PasswordHasher passwordHasher) {
        this.findUserUseCase = findUserUseCase;
        this.passwordHasher = passwordHasher;
        this.dummyHash = passwordHasher.hash("vinheria-dummy-password");
    }

    @Override
    public VerifiedIdentity verifyLogin(String email, String plaintextPassword,
                                        String presentedToken, String expectedToken) {
        if (expectedToken == null || expectedToken.isBlank()) {
            log.error("Login rejected: access token is not configured");
            throw new InvalidAccessTokenException("Access token is not configured");
        }
        if (presentedToken == null || !constantTimeEquals(presentedToken, expectedToken)) {
            log.warn("Login rejected: invalid access token");
            throw new InvalidAccessTokenException("Access token mismatch");
        }

        String password = plaintextPassword == null ? "" : plaintextPassword;
        User user;
        try {
            user = findUserUseCase.findByEmail(email);
        } catch (UserNotFoundException e) {
            passwordHasher.matches(password, dummyHash);
            log.warn("Login rejected: invalid credentials");
            throw new InvalidCredentialsException();
        }

        if (!passwordHasher.matches(password, user.passwordHash())) {
            log.warn("Login rejected: invalid credentials");
            throw new InvalidCredentialsException();
        }

        return new VerifiedIdentity(user.id(), user.email());
    }

    private static boolean constantTimeEquals(String presented, String expected) {
        return MessageDigest.isEqual(
                presented.getBytes(StandardCharsets.UTF_8),
                expected.getBytes(StandardCharsets.UTF_8));
    }
}
