package com.tradeerp.invoicing.service;

import com.tradeerp.invoicing.exception.NotFoundException;
import com.tradeerp.invoicing.model.CounterpartyKind;
import com.tradeerp.invoicing.model.Customer;
import com.tradeerp.invoicing.model.Supplier;
import com.tradeerp.invoicing.repository.CustomerRepository;
import com.tradeerp.invoicing.repository.SupplierRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Resolves invoice counterparties by explicit lookup.
 */
@Service
@Transactional(readOnly = true)
public class CounterpartyDirectory {

    private final CustomerRepository customerRepository;
    private final SupplierRepository supplierRepository;

    public CounterpartyDirectory(CustomerRepository customerRepository, SupplierRepository supplierRepository) {
        this.customerRepository = customerRepository;
        this.supplierRepository = supplierRepository;
    }

    public CounterpartyProfile profile(CounterpartyKind kind, Long id) {
        if (kind == CounterpartyKind.CUSTOMER) {
            Customer c = customerRepository.findById(id)
                    .orElseThrow(() -> new NotFoundException("Customer not found: " + id));
            return new CounterpartyProfile(c.getId(), kind, c.getName(), c.isActive(), c.isNonFiler(),
                    c.getPaymentTermsDays(), c.getCreditLimit());
        }
        Supplier s = supplierRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Supplier not found: " + id));
        return new CounterpartyProfile(s.getId(), kind, s.getName(), s.isActive(), s.isNonFiler(),
                s.getPaymentTermsDays(), null);
    }

    public boolean isActive(CounterpartyKind kind, Long id) {
        return profile(kind, id).active();
    }
}
