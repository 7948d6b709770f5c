package com.fintech.donations.repository;

import com.fintech.donations.entity.ReceiptCounter;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ReceiptCounterRepository extends JpaRepository<ReceiptCounter, Integer> {
}
