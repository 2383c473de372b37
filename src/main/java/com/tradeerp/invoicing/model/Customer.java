package com.tradeerp.invoicing.model;

import jakarta.persistence.*;
import lombok.Data;

@Entity
@Table(name = "customers")
@Data
public class Customer {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true, length = 30)
    private String code;

    @Column(nullable = false)
    private String name;

    @Column(length = 30)
    private String taxNumber; // NTN; blank for non-filers

    private String phoneNumber;
    private String email;
    private String address;

    private boolean active = true;

    // Counterparty without tax-filer status attracts non-filer GST and income tax
    private boolean nonFiler = false;

    private Integer paymentTermsDays;

    @Column(precision = 19, scale = 2)
    private java.math.BigDecimal creditLimit; // Max allowed outstanding balance
}
