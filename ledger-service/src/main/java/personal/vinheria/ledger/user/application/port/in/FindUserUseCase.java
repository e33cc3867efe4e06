package personal.vinheria.ledger.user.application.port.in;

import personal.vinheria.ledger.user.domain.model.User;

/**
 * Find User UseCase (Input Port)
 */
public interface FindUserUseCase {

    /**
     * 정규화된 이메일로 사용자 조회
     * @param email 이메일 (정규화 전)
     * @return 사용자 정보
     * @throws personal.vinheria.ledger.user.domain.exception.UserNotFoundException 사용자가 존재하지 않을 때
     */
    User findByEmail(String email);
}
