package personal.vinheria.common.health;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;

@DisplayName("HealthCheckService 테스트")
class HealthCheckServiceTest {

    private final HealthCheckService healthCheckService = new HealthCheckService();

    @Test
    @DisplayName("연결이 유효하면 UP")
    void checkDatabase_Up() throws SQLException {
        DataSource dataSource = mock(DataSource.class);
        Connection connection = mock(Connection.class);
        given(dataSource.getConnection()).willReturn(connection);
        given(connection.isValid(1)).willReturn(true);

        assertThat(healthCheckService.checkDatabase(dataSource)).isEqualTo(HealthCheckService.UP);
    }

    @Test
    @DisplayName("연결 실패 시 DOWN")
    void checkDatabase_Down() throws SQLException {
        DataSource dataSource = mock(DataSource.class);
        given(dataSource.getConnection()).willThrow(new SQLException("connection refused"));

        assertThat(healthCheckService.checkDatabase(dataSource)).isEqualTo(HealthCheckService.DOWN);
    }
}
