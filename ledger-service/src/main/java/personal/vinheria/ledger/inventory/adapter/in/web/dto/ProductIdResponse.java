package personal.vinheria.ledger.inventory.adapter.in.web.dto;

public record ProductIdResponse(Long productId) {
}
