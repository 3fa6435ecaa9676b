package com.creator.settlement.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "device_fingerprints", indexes = {
    @Index(name = "idx_device_fingerprint", columnList = "fingerprint"),
    @Index(name = "idx_device_user_fingerprint", columnList = "user_id, fingerprint")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeviceFingerprintEntity {

    @Id
    @Column(name = "id", nullable = false)
    private String id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "fingerprint", nullable = false, length = 64)
    private String fingerprint;

    @Column(name = "user_agent", length = 500)
    private String userAgent;

    @Column(name = "screen_resolution", length = 50)
    private String screenResolution;

    @Column(name = "timezone", length = 100)
    private String timezone;

    @Column(name = "language", length = 50)
    private String language;

    @Column(name = "ip_address", length = 64)
    private String ipAddress;

    @Column(name = "trusted", nullable = false)
    private boolean trusted;

    @Column(name = "last_seen_at", nullable = false)
    private Instant lastSeenAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (lastSeenAt == null) {
            lastSeenAt = now;
        }
    }
}
