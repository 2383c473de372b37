package com.tradeerp.invoicing.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BatchInfo {

    @Column(name = "batch_number", length = 50)
    private String batchNumber;

    @Column(name = "manufacturing_date")
    private LocalDate manufacturingDate;

    @Column(name = "expiry_date")
    private LocalDate expiryDate;

    public BatchInfo copy() {
        return new BatchInfo(batchNumber, manufacturingDate, expiryDate);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return batchNumber == null && manufacturingDate == null && expiryDate == null;
    }
}
