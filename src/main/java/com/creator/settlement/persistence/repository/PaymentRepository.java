package com.creator.settlement.persistence.repository;

import com.creator.settlement.persistence.entity.PaymentEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;

@Repository
public interface PaymentRepository extends JpaRepository<PaymentEntity, String> {

    long countByPayerIdAndCreatedAtGreaterThanEqual(String payerId, Instant since);
}
