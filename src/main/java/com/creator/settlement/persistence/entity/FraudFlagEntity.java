package com.creator.settlement.persistence.entity;

import com.creator.settlement.risk.domain.FraudFlagType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Advisory fraud signal. Append-only except for the resolution columns.
 */
@Entity
@Table(name = "fraud_flags", indexes = {
    @Index(name = "idx_flag_resolved", columnList = "is_resolved"),
    @Index(name = "idx_flag_type", columnList = "type"),
    @Index(name = "idx_flag_user", columnList = "user_id"),
    @Index(name = "idx_flag_created_at", columnList = "created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FraudFlagEntity {

    @Id
    @Column(name = "id", nullable = false)
    private String id;

    @Column(name = "user_id")
    private String userId;

    @Column(name = "creator_id")
    private String creatorId;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 30)
    private FraudFlagType type;

    @Column(name = "severity", nullable = false)
    private int severity;

    @Column(name = "description", length = 1000)
    private String description;

    @Convert(converter = MetadataJsonConverter.class)
    @Column(name = "metadata", columnDefinition = "TEXT")
    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    @Column(name = "is_resolved", nullable = false)
    private boolean resolved;

    @Column(name = "resolved_by")
    private String resolvedBy;

    @Column(name = "resolution", columnDefinition = "TEXT")
    private String resolution;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
