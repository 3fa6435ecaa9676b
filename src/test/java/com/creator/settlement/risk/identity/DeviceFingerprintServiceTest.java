package com.creator.settlement.risk.identity;

import com.creator.settlement.persistence.entity.DeviceFingerprintEntity;
import com.creator.settlement.persistence.repository.DeviceFingerprintRepository;
import com.creator.settlement.risk.domain.DeviceSignals;
import com.creator.settlement.risk.domain.FraudFlagType;
import com.creator.settlement.risk.domain.NewFraudFlag;
import com.creator.settlement.risk.flags.FraudFlagRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DeviceFingerprintServiceTest {

    @Mock
    private DeviceFingerprintRepository fingerprintRepository;

    @Mock
    private FraudFlagRegistry fraudFlagRegistry;

    @InjectMocks
    private DeviceFingerprintService service;

    private static DeviceSignals signals(String ip) {
        return DeviceSignals.builder()
                .userAgent("Mozilla/5.0")
                .screenResolution("1920x1080")
                .timezone("America/Sao_Paulo")
                .language("pt-BR")
                .ipAddress(ip)
                .build();
    }

    @Test
    void fingerprintIsStableSha256Hex() {
        String first = service.generateFingerprint(signals("200.1.2.3"));
        String second = service.generateFingerprint(signals("200.1.2.3"));

        assertThat(first).hasSize(64).matches("[0-9a-f]+").isEqualTo(second);
        assertThat(service.generateFingerprint(signals("200.1.2.4"))).isNotEqualTo(first);
    }

    @Test
    void absentSignalDiffersFromPresentOne() {
        DeviceSignals partial = DeviceSignals.builder().userAgent("Mozilla/5.0").build();

        assertThat(service.generateFingerprint(partial)).isNotEqualTo(service.generateFingerprint(signals(null)));
    }

    @Test
    void knownDeviceOnlyRefreshesLastSeen() {
        String fingerprint = service.generateFingerprint(signals("200.1.2.3"));
        DeviceFingerprintEntity known = DeviceFingerprintEntity.builder()
                .id("d-1").userId("u-1").fingerprint(fingerprint)
                .lastSeenAt(Instant.parse("2024-01-01T00:00:00Z"))
                .build();
        when(fingerprintRepository.findByUserIdAndFingerprint("u-1", fingerprint)).thenReturn(Optional.of(known));

        service.recordDeviceFingerprint("u-1", signals("200.1.2.3"));

        assertThat(known.getLastSeenAt()).isAfter(Instant.parse("2024-01-01T00:00:00Z"));
        verify(fingerprintRepository).save(known);
        verify(fingerprintRepository, never()).findFirstByFingerprintAndUserIdNot(anyString(), anyString());
        verify(fraudFlagRegistry, never()).raise(any());
    }

    @Test
    void deviceSeenOnAnotherAccountIsFlagged() {
        String fingerprint = service.generateFingerprint(signals("200.1.2.3"));
        when(fingerprintRepository.findByUserIdAndFingerprint("u-2", fingerprint)).thenReturn(Optional.empty());
        when(fingerprintRepository.findFirstByFingerprintAndUserIdNot(fingerprint, "u-2"))
                .thenReturn(Optional.of(DeviceFingerprintEntity.builder().id("d-1").userId("u-1").fingerprint(fingerprint).build()));

        String result = service.recordDeviceFingerprint("u-2", signals("200.1.2.3"));

        assertThat(result).isEqualTo(fingerprint);
        ArgumentCaptor<NewFraudFlag> flag = ArgumentCaptor.forClass(NewFraudFlag.class);
        verify(fraudFlagRegistry).raise(flag.capture());
        assertThat(flag.getValue().getType()).isEqualTo(FraudFlagType.DEVICE_FINGERPRINT);
        assertThat(flag.getValue().getSeverity()).isEqualTo(3);
        assertThat(flag.getValue().getDescription()).contains("u-2").contains("u-1");
        assertThat(flag.getValue().getMetadata()).containsEntry("sharedWithUserId", "u-1");

        ArgumentCaptor<DeviceFingerprintEntity> saved = ArgumentCaptor.forClass(DeviceFingerprintEntity.class);
        verify(fingerprintRepository).save(saved.capture());
        assertThat(saved.getValue().getUserId()).isEqualTo("u-2");
        assertThat(saved.getValue().getTimezone()).isEqualTo("America/Sao_Paulo");
    }

    @Test
    void firstSightingOfDeviceIsNotFlagged() {
        when(fingerprintRepository.findByUserIdAndFingerprint(anyString(), anyString())).thenReturn(Optional.empty());
        when(fingerprintRepository.findFirstByFingerprintAndUserIdNot(anyString(), anyString())).thenReturn(Optional.empty());

        service.recordDeviceFingerprint("u-1", signals("200.1.2.3"));

        verify(fraudFlagRegistry, never()).raise(any());
        verify(fingerprintRepository).save(any(DeviceFingerprintEntity.class));
    }
}
