package personal.vinheria.ledger.user.application.port.out;

/**
 * Password Hasher (Output Port)
 * 솔트 포함 단방향 해시. 비교는 해시 기반으로만 수행한다.
 */
public interface PasswordHasher {

    String hash(String plaintextPassword);

    boolean matches(String plaintextPassword, String passwordHash);
}
