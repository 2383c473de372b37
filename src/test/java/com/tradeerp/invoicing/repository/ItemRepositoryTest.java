package com.tradeerp.invoicing.repository;

import com.tradeerp.invoicing.exception.NotFoundException;
import com.tradeerp.invoicing.model.Item;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
class ItemRepositoryTest {

    @Autowired
    private ItemRepository itemRepository;

    private Item newItem(String code) {
        Item item = new Item();
        item.setCode(code);
        item.setName("Item " + code);
        return itemRepository.saveAndFlush(item);
    }

    @Test
    void adjustStock_ShouldApplyRelativeDeltas() {
        Item item = newItem("SUGAR-1");

        assertEquals(0, new BigDecimal("10").compareTo(itemRepository.adjustStock(item.getId(), new BigDecimal("10"))));
        assertEquals(0, new BigDecimal("6.5").compareTo(itemRepository.adjustStock(item.getId(), new BigDecimal("-3.5"))));
        assertEquals(0, new BigDecimal("-1.5").compareTo(itemRepository.adjustStock(item.getId(), new BigDecimal("-8"))));

        assertEquals(0, new BigDecimal("-1.5").compareTo(itemRepository.findCurrentStock(item.getId()).orElseThrow()));
    }

    @Test
    void adjustStock_MissingItem_ShouldThrowNotFound() {
        assertThrows(NotFoundException.class, () -> itemRepository.adjustStock(987654L, BigDecimal.ONE));
    }

    @Test
    void findActiveFlag_ShouldReflectItem() {
        Item item = newItem("RICE-5");
        item.setActive(false);
        itemRepository.saveAndFlush(item);

        assertFalse(itemRepository.findActiveFlag(item.getId()).orElseThrow());
        assertTrue(itemRepository.findByCode("RICE-5").isPresent());
    }
}
