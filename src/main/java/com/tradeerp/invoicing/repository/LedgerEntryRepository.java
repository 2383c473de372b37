package com.tradeerp.invoicing.repository;

import com.tradeerp.invoicing.model.LedgerEntry;
import com.tradeerp.invoicing.model.LedgerReferenceType;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface LedgerEntryRepository extends JpaRepository<LedgerEntry, Long> {
    List<LedgerEntry> findByReferenceTypeAndReferenceIdOrderByIdAsc(LedgerReferenceType referenceType,
            Long referenceId);
}
