package personal.vinheria.ledger.auth.application.port.in;

import personal.vinheria.ledger.auth.domain.model.VerifiedIdentity;

/**
 * Verify Login UseCase (Input Port)
 */
public interface VerifyLoginUseCase {

    /**
     * 비밀번호와 공용 접근 토큰으로 로그인 시도를 검증
     * @param email             이메일 (정규화 전)
     * @param plaintextPassword 평문 비밀번호
     * @param presentedToken    사용자가 제시한 접근 토큰
     * @param expectedToken     설정된 접근 토큰 (비어 있으면 항상 실패)
     * @return 검증된 사용자
     * @throws personal.vinheria.ledger.auth.domain.exception.InvalidAccessTokenException 접근 토큰 불일치 (가장 먼저 검사)
     * @throws personal.vinheria.ledger.auth.domain.exception.InvalidCredentialsException 이메일 또는 비밀번호 불일치
     */
    VerifiedIdentity verifyLogin(String email, String plaintextPassword,
                                 String presentedToken, String expectedToken);
}
