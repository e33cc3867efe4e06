package personal.vinheria.ledger.user.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.vinheria.ledger.user.domain.model.User;

/**
 * User JPA Entity
 * users 테이블 매핑 (email UNIQUE)
 */
@Entity
@Table(name = "users",
        uniqueConstraints = @UniqueConstraint(name = "uk_users_email", columnNames = "email"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class UserEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = User.MAX_EMAIL_LENGTH)
    private String email;

    @Column(name = "password_hash", nullable = false, length = 100)
    private String passwordHash;

    /**
     * 신규 사용자 엔티티 생성
     */
    public static UserEntity of(String email, String passwordHash) {
        UserEntity entity = new UserEntity();
        entity.email = email;
        entity.passwordHash = passwordHash;
        return entity;
    }

    /**
     * 도메인 모델로 변환
     */
    public User toDomain() {
        return new User(id, email, passwordHash);
    }
}
