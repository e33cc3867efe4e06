package personal.vinheria.ledger.user.adapter.out.crypto;

import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.stereotype.Component;
import personal.vinheria.ledger.user.application.port.out.PasswordHasher;

/**
 * BCrypt 기반 비밀번호 해시 (cost 10)
 */
@Component
public class BcryptPasswordHasher implements PasswordHasher {

    static final int STRENGTH = 10;

    private final BCryptPasswordEncoder encoder = new BCryptPasswordEncoder(STRENGTH);

    @Override
    public String hash(String plaintextPassword) {
        return encoder.encode(plaintextPassword);
    }

    @Override
    public boolean matches(String plaintextPassword, String passwordHash) {
        if (plaintextPassword == null || passwordHash == null) {
            return false;
        }
        return encoder.matches(plaintextPassword, passwordHash);
    }
}
