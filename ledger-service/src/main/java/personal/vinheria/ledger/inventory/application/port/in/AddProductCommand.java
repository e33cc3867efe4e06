package personal.vinheria.ledger.inventory.application.port.in;

import personal.vinheria.ledger.inventory.domain.exception.InvalidProductException;

/**
 * 상품 추가 Command
 * 이름은 trim 후 비어 있으면 거부, 초기 수량은 0 미만이면 0으로 보정한다.
 */
public record AddProductCommand(
        String name,
        int initialQuantity
) {
    public AddProductCommand {
        name = name == null ? "" : name.trim();
        if (name.isEmpty()) {
            throw new InvalidProductException("Product name cannot be blank");
        }
        initialQuantity = Math.max(initialQuantity, 0);
    }

    /**
     * 폼 입력처럼 문자열로 들어온 수량을 해석한다. 없거나 숫자가 아니면 0.
     */
    public static AddProductCommand of(String name, String rawQuantity) {
        return new AddProductCommand(name, parseQuantity(rawQuantity));
    }

    static int parseQuantity(String rawQuantity) {
        if (rawQuantity == null || rawQuantity.isBlank()) {
            return 0;
        }
        try {
            return Integer.parseInt(rawQuantity.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
