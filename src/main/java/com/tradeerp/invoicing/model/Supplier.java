package com.tradeerp.invoicing.model;

import jakarta.persistence.*;
import lombok.Data;

@Entity
@Table(name = "suppliers")
@Data
public class Supplier {
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

    private boolean active = true;

    private boolean nonFiler = false;

    private Integer paymentTermsDays;
}
