package com.tradeerp.invoicing.model;

import jakarta.persistence.*;
import lombok.Data;

import java.math.BigDecimal;

@Entity
@Table(name = "items")
@Data
public class Item {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true, nullable = false)
    private String code;

    @Column(nullable = false)
    private String name;

    private boolean active = true;

    // Running counter, only ever changed by relative updates in ItemRepository
    @Column(nullable = false, precision = 19, scale = 3)
    private BigDecimal currentStock = BigDecimal.ZERO;

    @Column(precision = 19, scale = 3)
    private BigDecimal minStock = BigDecimal.ZERO;

    // Default GST rate for lines that do not carry their own
    @Column(precision = 7, scale = 3)
    private BigDecimal gstRate = BigDecimal.ZERO;
}
