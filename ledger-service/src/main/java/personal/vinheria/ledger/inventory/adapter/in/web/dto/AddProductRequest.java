package personal.vinheria.ledger.inventory.adapter.in.web.dto;

import personal.vinheria.ledger.inventory.application.port.in.AddProductCommand;

/**
 * 상품 추가 요청 DTO
 *
 * @param name     상품명
 * @param quantity 초기 수량 (원시 입력값, 숫자가 아니거나 없으면 0)
 */
public record AddProductRequest(
        String name,
        String quantity
) {
    public AddProductCommand toCommand() {
        return AddProductCommand.of(name, quantity);
    }
}
