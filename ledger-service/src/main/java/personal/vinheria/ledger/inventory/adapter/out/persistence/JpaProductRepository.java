package personal.vinheria.ledger.inventory.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Spring Data JPA Repository for Product
 * 수량 변경은 모두 단일 UPDATE 문이므로 동시 요청 간 lost update가 발생하지 않는다.
 */
public interface JpaProductRepository extends JpaRepository<ProductEntity, Long> {

    List<ProductEntity> findAllByOrderByIdAsc();

    /**
     * int 최댓값에서는 더 증가시키지 않고 그대로 둔다.
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE ProductEntity p "
            + "SET p.quantity = CASE WHEN p.quantity < 2147483647 THEN p.quantity + 1 ELSE p.quantity END "
            + "WHERE p.id = :id")
    int incrementQuantity(@Param("id") Long id);

    /**
     * 0에서 감소시키면 값은 그대로지만 행은 매칭되므로 1을 반환한다.
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE ProductEntity p "
            + "SET p.quantity = CASE WHEN p.quantity > 0 THEN p.quantity - 1 ELSE 0 END "
            + "WHERE p.id = :id")
    int decrementQuantity(@Param("id") Long id);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("DELETE FROM ProductEntity p WHERE p.id = :id")
    int deleteProductById(@Param("id") Long id);
}
