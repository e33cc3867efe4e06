package personal.vinheria.ledger.user.application.port.out;

import personal.vinheria.ledger.user.domain.model.User;

import java.util.Optional;

/**
 * User Repository (Output Port)
 * 사용자 저장소 인터페이스. 수정/삭제 연산은 제공하지 않는다.
 */
public interface UserRepository {

    /**
     * 정규화된 이메일로 조회
     * @param email 정규화된 이메일
     * @return 사용자 정보 (없으면 Optional.empty())
     */
    Optional<User> findByEmail(String email);

    /**
     * 이메일 존재 여부 확인
     */
    boolean existsByEmail(String email);

    /**
     * 신규 사용자 저장
     * @param email        정규화된 이메일
     * @param passwordHash 비밀번호 해시
     * @return 저장된 사용자
     * @throws personal.vinheria.ledger.user.domain.exception.DuplicateIdentityException 유니크 제약 위반 시
     */
    User create(String email, String passwordHash);
}
