package com.tradeerp.invoicing.repository;

import com.tradeerp.invoicing.model.Supplier;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SupplierRepository extends JpaRepository<Supplier, Long> {
}
