package com.creator.settlement.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Creator balance in minor units. Mutated only through the conditional updates in
 * {@link com.creator.settlement.persistence.repository.BalanceRepository}.
 */
@Entity
@Table(name = "balances", uniqueConstraints = {
    @UniqueConstraint(name = "uk_balance_creator", columnNames = "creator_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BalanceEntity {

    @Id
    @Column(name = "id", nullable = false)
    private String id;

    @Column(name = "creator_id", nullable = false)
    private String creatorId;

    @Column(name = "available", nullable = false)
    private long available;

    @Column(name = "pending", nullable = false)
    private long pending;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    protected void touch() {
        updatedAt = Instant.now();
    }
}
