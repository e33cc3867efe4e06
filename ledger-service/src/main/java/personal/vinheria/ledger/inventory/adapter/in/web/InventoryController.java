package personal.vinheria.ledger.inventory.adapter.in.web;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.vinheria.common.web.ApiResponse;
import personal.vinheria.ledger.gate.adapter.in.web.GatedResponses;
import personal.vinheria.ledger.gate.application.AccessGate;
import personal.vinheria.ledger.gate.application.GuardResult;
import personal.vinheria.ledger.inventory.adapter.in.web.dto.AddProductRequest;
import personal.vinheria.ledger.inventory.adapter.in.web.dto.ProductIdResponse;
import personal.vinheria.ledger.inventory.adapter.in.web.dto.ProductResponse;
import personal.vinheria.ledger.inventory.application.port.in.AddProductCommand;
import personal.vinheria.ledger.inventory.application.port.in.AddProductUseCase;
import personal.vinheria.ledger.inventory.application.port.in.AdjustStockUseCase;
import personal.vinheria.ledger.inventory.application.port.in.DeleteProductUseCase;
import personal.vinheria.ledger.inventory.application.port.in.ListProductsUseCase;
import personal.vinheria.ledger.session.adapter.in.web.SessionCookieManager;
import personal.vinheria.ledger.session.domain.model.SessionHandle;

import java.util.List;

/**
 * Inventory API Controller
 * 모든 엔드포인트는 Access Gate를 통과해야 하며, 세션이 없으면 로그인 경로로 302 응답한다.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/inventory")
@RequiredArgsConstructor
public class InventoryController {

    private final ListProductsUseCase listProductsUseCase;
    private final AddProductUseCase addProductUseCase;
    private final AdjustStockUseCase adjustStockUseCase;
    private final DeleteProductUseCase deleteProductUseCase;
    private final AccessGate accessGate;
    private final SessionCookieManager sessionCookieManager;
    private final GatedResponses gatedResponses;

    /**
     * 재고 목록 조회
     * GET /api/v1/inventory
     */
    @GetMapping
    public ResponseEntity<ApiResponse<List<ProductResponse>>> list(HttpServletRequest request,
                                                                   HttpServletResponse response) {
        GuardResult<List<ProductResponse>> result = accessGate.guard(handleOf(request),
                identity -> listProductsUseCase.listProducts()
                        .stream()
                        .map(ProductResponse::from)
                        .toList());
        return gatedResponses.toResponse(result, response,
                products -> ResponseEntity.ok(ApiResponse.success("재고 목록", products)));
    }

    /**
     * 상품 추가
     * POST /api/v1/inventory
     */
    @PostMapping
    public ResponseEntity<ApiResponse<ProductIdResponse>> add(@RequestBody AddProductRequest body,
                                                              HttpServletRequest request,
                                                              HttpServletResponse response) {
        GuardResult<Long> result = accessGate.guard(handleOf(request), identity -> {
            AddProductCommand command = body.toCommand();
            log.info("Add product: userId={}, name={}", identity.userId(), command.name());
            return addProductUseCase.addProduct(command);
        });
        return gatedResponses.toResponse(result, response,
                productId -> ResponseEntity.status(HttpStatus.CREATED)
                        .body(ApiResponse.success("상품이 추가되었습니다.", new ProductIdResponse(productId))));
    }

    /**
     * 수량 +1
     * POST /api/v1/inventory/{productId}/increment
     */
    @PostMapping("/{productId}/increment")
    public ResponseEntity<ApiResponse<Void>> increment(@PathVariable Long productId,
                                                       HttpServletRequest request,
                                                       HttpServletResponse response) {
        GuardResult<Long> result = accessGate.guard(handleOf(request), identity -> {
            log.info("Increment stock: userId={}, productId={}", identity.userId(), productId);
            adjustStockUseCase.increment(productId);
            return productId;
        });
        return gatedResponses.toResponse(result, response,
                id -> ResponseEntity.ok(ApiResponse.success("수량이 증가했습니다.")));
    }

    /**
     * 수량 -1 (0 미만으로 내려가지 않음)
     * POST /api/v1/inventory/{productId}/decrement
     */
    @PostMapping("/{productId}/decrement")
    public ResponseEntity<ApiResponse<Void>> decrement(@PathVariable Long productId,
                                                       HttpServletRequest request,
                                                       HttpServletResponse response) {
        GuardResult<Long> result = accessGate.guard(handleOf(request), identity -> {
            log.info("Decrement stock: userId={}, productId={}", identity.userId(), productId);
            adjustStockUseCase.decrement(productId);
            return productId;
        });
        return gatedResponses.toResponse(result, response,
                id -> ResponseEntity.ok(ApiResponse.success("수량이 감소했습니다.")));
    }

    /**
     * 상품 삭제 (없는 상품이어도 성공)
     * DELETE /api/v1/inventory/{productId}
     */
    @DeleteMapping("/{productId}")
    public ResponseEntity<ApiResponse<Void>> delete(@PathVariable Long productId,
                                                    HttpServletRequest request,
                                                    HttpServletResponse response) {
        GuardResult<Long> result = accessGate.guard(handleOf(request), identity -> {
            log.info("Delete product: userId={}, productId={}", identity.userId(), productId);
            deleteProductUseCase.deleteProduct(productId);
            return productId;
        });
        return gatedResponses.toResponse(result, response,
                id -> ResponseEntity.ok(ApiResponse.success("상품이 삭제되었습니다.")));
    }

    private SessionHandle handleOf(HttpServletRequest request) {
        return sessionCookieManager.resolve(request);
    }
}
