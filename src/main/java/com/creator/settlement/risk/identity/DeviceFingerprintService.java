package com.creator.settlement.risk.identity;

import com.creator.settlement.compliance.SensitiveDataMasker;
import com.creator.settlement.persistence.entity.DeviceFingerprintEntity;
import com.creator.settlement.persistence.repository.DeviceFingerprintRepository;
import com.creator.settlement.risk.domain.DeviceSignals;
import com.creator.settlement.risk.domain.FraudFlagType;
import com.creator.settlement.risk.domain.NewFraudFlag;
import com.creator.settlement.risk.flags.FraudFlagRegistry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Correlates browser fingerprints across accounts. Seeing one device on a second account is a
 * multi-accounting signal.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeviceFingerprintService {

    static final int SHARED_DEVICE_SEVERITY = 3;

    // Plain mapper: property order and inclusion come from the DeviceSignals annotations only
    private static final ObjectMapper CANONICAL_JSON = new ObjectMapper();

    private final DeviceFingerprintRepository fingerprintRepository;
    private final FraudFlagRegistry fraudFlagRegistry;

    /**
     * SHA-256 hex over the canonical JSON of the signals.
     */
    public String generateFingerprint(DeviceSignals signals) {
        try {
            byte[] json = CANONICAL_JSON.writeValueAsBytes(signals);
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(json);
            return HexFormat.of().formatHex(hash);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Device signals are not serializable", e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Refreshes {@code lastSeenAt} for a known (user, device) pair; otherwise stores the device and
     * flags it when another user already used it.
     *
     * @return the fingerprint
     */
    @Transactional
    public String recordDeviceFingerprint(String userId, DeviceSignals signals) {
        String fingerprint = generateFingerprint(signals);
        Optional<DeviceFingerprintEntity> known = fingerprintRepository.findByUserIdAndFingerprint(userId, fingerprint);
        if (known.isPresent()) {
            DeviceFingerprintEntity device = known.get();
            device.setLastSeenAt(Instant.now());
            fingerprintRepository.save(device);
            return fingerprint;
        }

        fingerprintRepository.findFirstByFingerprintAndUserIdNot(fingerprint, userId).ifPresent(other -> {
            log.warn("Shared device: fingerprint={} userId={} alsoUsedBy={}",
                    SensitiveDataMasker.shortFingerprint(fingerprint), userId, other.getUserId());
            Map<String, Object> metadata = new HashMap<>();
            metadata.put("fingerprint", fingerprint);
            metadata.put("sharedWithUserId", other.getUserId());
            fraudFlagRegistry.raise(NewFraudFlag.builder()
                    .userId(userId)
                    .type(FraudFlagType.DEVICE_FINGERPRINT)
                    .severity(SHARED_DEVICE_SEVERITY)
                    .description("Device shared between users " + userId + " and " + other.getUserId())
                    .metadata(metadata)
                    .build());
        });

        fingerprintRepository.save(DeviceFingerprintEntity.builder()
                .id(UUID.randomUUID().toString())
                .userId(userId)
                .fingerprint(fingerprint)
                .userAgent(signals.getUserAgent())
                .screenResolution(signals.getScreenResolution())
                .timezone(signals.getTimezone())
                .language(signals.getLanguage())
                .ipAddress(signals.getIpAddress())
                .lastSeenAt(Instant.now())
                .build());
        log.debug("Recorded new device for userId={} fingerprint={}",
                userId, SensitiveDataMasker.shortFingerprint(fingerprint));
        return fingerprint;
    }
}
