package personal.vinheria.ledger.inventory.application.port.in;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullSource;
import org.junit.jupiter.params.provider.ValueSource;
import personal.vinheria.ledger.inventory.domain.exception.InvalidProductException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AddProductCommand 테스트")
class AddProductCommandTest {

    @Test
    @DisplayName("이름은 trim, 수량은 그대로")
    void of_Normal() {
        AddProductCommand command = AddProductCommand.of("  Tinto Reserva  ", "12");

        assertThat(command.name()).isEqualTo("Tinto Reserva");
        assertThat(command.initialQuantity()).isEqualTo(12);
    }

    @ParameterizedTest
    @NullSource
    @ValueSource(strings = {"", "   ", "abc", "1.5"})
    @DisplayName("없거나 숫자가 아닌 수량은 0")
    void of_UnparseableQuantity(String rawQuantity) {
        assertThat(AddProductCommand.of("Branco", rawQuantity).initialQuantity()).isZero();
    }

    @Test
    @DisplayName("음수 수량은 0으로 보정")
    void of_NegativeQuantity() {
        assertThat(AddProductCommand.of("Branco", "-5").initialQuantity()).isZero();
    }

    @ParameterizedTest
    @NullSource
    @ValueSource(strings = {"", "   "})
    @DisplayName("빈 이름은 거부")
    void of_BlankName(String name) {
        assertThatThrownBy(() -> AddProductCommand.of(name, "3"))
                .isInstanceOf(InvalidProductException.class);
    }

    @Test
    @DisplayName("긴 이름도 길이 제한 없이 그대로 유지")
    void of_LongName() {
        String longName = "n".repeat(250);

        assertThat(AddProductCommand.of(longName, "1").name()).isEqualTo(longName);
    }
}
