package com.creator.settlement.persistence.entity;

import com.creator.settlement.domain.PayoutStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A creator withdrawal. {@code amount} is the gross debited from the ledger; {@code netAmount}
 * is what the gateway transfers after the fee.
 */
@Entity
@Table(name = "payouts", indexes = {
    @Index(name = "idx_payout_creator_created", columnList = "creator_id, created_at"),
    @Index(name = "idx_payout_status", columnList = "status"),
    @Index(name = "idx_payout_transfer", columnList = "external_transfer_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PayoutEntity {

    @Id
    @Column(name = "id", nullable = false)
    private String id;

    @Column(name = "creator_id", nullable = false)
    private String creatorId;

    @Column(name = "amount", nullable = false)
    private long amount;

    @Column(name = "fee", nullable = false)
    private long fee;

    @Column(name = "net_amount", nullable = false)
    private long netAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private PayoutStatus status;

    @Column(name = "external_transfer_id")
    private String externalTransferId;

    @Column(name = "failed_reason", length = 500)
    private String failedReason;

    @Column(name = "processed_at")
    private Instant processedAt;

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
