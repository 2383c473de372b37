package com.tradeerp.invoicing.repository;

import com.tradeerp.invoicing.exception.NotFoundException;
import com.tradeerp.invoicing.model.Item;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.util.Optional;

public interface ItemRepository extends JpaRepository<Item, Long> {
    Optional<Item> findByCode(String code);

    // Relative update in a single statement; never read-modify-write
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Item i SET i.currentStock = i.currentStock + :delta WHERE i.id = :itemId")
    int incrementStock(@Param("itemId") Long itemId, @Param("delta") BigDecimal delta);

    @Query("SELECT i.currentStock FROM Item i WHERE i.id = :itemId")
    Optional<BigDecimal> findCurrentStock(@Param("itemId") Long itemId);

    @Query("SELECT i.active FROM Item i WHERE i.id = :itemId")
    Optional<Boolean> findActiveFlag(@Param("itemId") Long itemId);

    /**
     * Atomically applies {@code delta} to the item's running stock counter.
     *
     * @return the counter after the adjustment
     * @throws NotFoundException if the item does not exist
     */
    default BigDecimal adjustStock(Long itemId, BigDecimal delta) {
        if (incrementStock(itemId, delta) == 0) {
            throw new NotFoundException("Item not found: " + itemId);
        }
        return findCurrentStock(itemId).orElseThrow(() -> new NotFoundException("Item not found: " + itemId));
    }
}
