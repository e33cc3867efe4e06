package personal.vinheria.ledger.inventory.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.vinheria.ledger.inventory.domain.model.Product;

/**
 * Product JPA Entity
 * products 테이블 매핑
 */
@Entity
@Table(name = "products")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ProductEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // 이름 길이는 제한하지 않는다
    @Column(nullable = false, columnDefinition = "TEXT")
    private String name;

    @Column(nullable = false)
    private int quantity;

    public static ProductEntity of(String name, int quantity) {
        ProductEntity entity = new ProductEntity();
        entity.name = name;
        entity.quantity = quantity;
        return entity;
    }

    /**
     * 도메인 모델로 변환
     */
    public Product toDomain() {
        return new Product(id, name, quantity);
    }
}
