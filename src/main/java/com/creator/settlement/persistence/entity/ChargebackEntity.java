package com.creator.settlement.persistence.entity;

import com.creator.settlement.domain.ChargebackStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A reversed payment charged against a creator. {@code penaltyApplied} guards the one-time
 * penalty on LOST.
 */
@Entity
@Table(name = "chargebacks", indexes = {
    @Index(name = "idx_chargeback_creator", columnList = "creator_id"),
    @Index(name = "idx_chargeback_payment", columnList = "payment_id")
}, uniqueConstraints = {
    @UniqueConstraint(name = "uk_chargeback_external_id", columnNames = "external_chargeback_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChargebackEntity {

    @Id
    @Column(name = "id", nullable = false)
    private String id;

    @Column(name = "payment_id", nullable = false)
    private String paymentId;

    @Column(name = "creator_id", nullable = false)
    private String creatorId;

    @Column(name = "amount", nullable = false)
    private long amount;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ChargebackStatus status;

    @Column(name = "external_chargeback_id")
    private String externalChargebackId;

    @Column(name = "penalty_amount")
    private Long penaltyAmount;

    @Column(name = "penalty_applied", nullable = false)
    private boolean penaltyApplied;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
