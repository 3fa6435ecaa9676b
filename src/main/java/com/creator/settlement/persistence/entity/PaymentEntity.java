package com.creator.settlement.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

/**
 * Read-only projection of the payments ledger, owned by the billing service. Used for
 * payment velocity counts.
 */
@Entity
@Immutable
@Table(name = "payments", indexes = {
    @Index(name = "idx_payment_payer_created", columnList = "payer_id, created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentEntity {

    @Id
    @Column(name = "id", nullable = false)
    private String id;

    @Column(name = "payer_id", nullable = false)
    private String payerId;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
