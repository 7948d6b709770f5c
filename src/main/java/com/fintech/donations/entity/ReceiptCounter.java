package com.fintech.donations.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Last issued receipt sequence number for one calendar year.
 */
@Entity
@Table(name = "receipt_counters")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReceiptCounter {

    @Id
    @Column(name = "receipt_year")
    private Integer year;

    @Column(name = "last_number", nullable = false)
    private Integer lastNumber;

    @Version
    private Long version;

    public ReceiptCounter(Integer year) {
        this.year = year;
        this.lastNumber = 0;
    }

    public int increment() {
        lastNumber = (lastNumber == null ? 0 : lastNumber) + 1;
        return lastNumber;
    }
}
