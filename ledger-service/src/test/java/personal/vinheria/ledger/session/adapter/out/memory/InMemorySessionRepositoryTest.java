package personal.vinheria.ledger.session.adapter.out.memory;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import personal.vinheria.ledger.auth.domain.model.VerifiedIdentity;
import personal.vinheria.ledger.session.domain.model.Session;
import personal.vinheria.ledger.session.domain.model.SessionHandle;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("InMemorySessionRepository 테스트")
class InMemorySessionRepositoryTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");
    private static final VerifiedIdentity IDENTITY = new VerifiedIdentity(1L, "a@x.com");

    private final InMemorySessionRepository repository = new InMemorySessionRepository();

    @Test
    @DisplayName("같은 핸들은 두 번 저장되지 않는다")
    void saveIfAbsent_RejectsDuplicateHandle() {
        SessionHandle handle = new SessionHandle("handle-aaaaaaaaaaaa");

        assertThat(repository.saveIfAbsent(Session.issue(handle, IDENTITY, NOW, Duration.ofHours(1)))).isTrue();
        assertThat(repository.saveIfAbsent(Session.issue(handle, IDENTITY, NOW, Duration.ofHours(1)))).isFalse();
        assertThat(repository.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("만료 시각이 지난 세션만 정리")
    void deleteExpired() {
        // given
        repository.saveIfAbsent(Session.issue(new SessionHandle("handle-old-aaaaaaaa"), IDENTITY, NOW, Duration.ofMinutes(10)));
        repository.saveIfAbsent(Session.issue(new SessionHandle("handle-new-bbbbbbbb"), IDENTITY, NOW, Duration.ofHours(1)));

        // when
        int removed = repository.deleteExpired(NOW.plus(Duration.ofMinutes(10)));

        // then
        assertThat(removed).isEqualTo(1);
        assertThat(repository.size()).isEqualTo(1);
        assertThat(repository.findByHandle(new SessionHandle("handle-new-bbbbbbbb"))).isPresent();
    }
}
