package com.creator.settlement.persistence.entity;

import com.creator.settlement.domain.KycStatus;
import com.creator.settlement.domain.PixKeyType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Settlement and risk state of a creator. Profile data lives with the content service;
 * this core only reads KYC and PIX fields and writes the block and chargeback columns.
 */
@Entity
@Table(name = "creators", indexes = {
    @Index(name = "idx_creator_user_id", columnList = "user_id"),
    @Index(name = "idx_creator_cpf_cnpj", columnList = "cpf_cnpj")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreatorEntity {

    @Id
    @Column(name = "id", nullable = false)
    private String id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "kyc_status", nullable = false, length = 20)
    @Builder.Default
    private KycStatus kycStatus = KycStatus.NONE;

    @Column(name = "payouts_blocked", nullable = false)
    private boolean payoutsBlocked;

    @Column(name = "payout_block_reason")
    private String payoutBlockReason;

    @Column(name = "is_pro", nullable = false)
    private boolean pro;

    @Column(name = "chargeback_count", nullable = false)
    private int chargebackCount;

    @Column(name = "chargeback_penalty_balance", nullable = false)
    private long chargebackPenaltyBalance;

    @Column(name = "pix_key")
    private String pixKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "pix_key_type", length = 10)
    private PixKeyType pixKeyType;

    @Column(name = "cpf_cnpj", length = 20)
    private String cpfCnpj;

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
