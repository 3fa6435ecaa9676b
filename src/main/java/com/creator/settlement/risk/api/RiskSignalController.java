package com.creator.settlement.risk.api;

import com.creator.settlement.risk.domain.DeviceSignals;
import com.creator.settlement.risk.domain.DocumentValidation;
import com.creator.settlement.risk.domain.VelocityCheckResult;
import com.creator.settlement.risk.domain.VelocityKind;
import com.creator.settlement.risk.identity.DeviceFingerprintService;
import com.creator.settlement.risk.identity.DuplicateIdentityService;
import com.creator.settlement.risk.identity.TaxIdValidator;
import com.creator.settlement.risk.velocity.VelocityGuard;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Risk checks used by the signup, payment and payout paths of other services.
 */
@Validated
@RestController
@RequestMapping("/api/v1/risk")
@RequiredArgsConstructor
@Tag(name = "Risk signals", description = "Velocity, identity and device checks")
public class RiskSignalController {

    private final VelocityGuard velocityGuard;
    private final DuplicateIdentityService duplicateIdentityService;
    private final DeviceFingerprintService deviceFingerprintService;

    @GetMapping("/velocity")
    @Operation(summary = "Check velocity", description = "Counts the actor's events in the trailing window; allowed while count < limit.")
    public VelocityCheckResult checkVelocity(@RequestParam VelocityKind kind,
                                             @RequestParam String actorId,
                                             @RequestParam(defaultValue = "60") @Min(1) @Max(10080) int windowMinutes,
                                             @RequestParam(defaultValue = "3") @Min(1) int limit) {
        return velocityGuard.checkVelocity(kind, actorId, windowMinutes, limit);
    }

    @PostMapping("/identity/validate")
    @Operation(summary = "Validate CPF/CNPJ", description = "Check-digit validation; type is picked by digit count.")
    public DocumentValidation validateDocument(@Valid @RequestBody DocumentRequestDto dto) {
        return TaxIdValidator.validate(dto.getCpfCnpj());
    }

    @PostMapping("/identity/duplicates")
    @Operation(summary = "Check duplicate identity",
            description = "Raises a DUPLICATE_IDENTITY flag when another account holds the document. 400 for malformed documents.")
    public DuplicateCheckResponseDto checkDuplicate(@Valid @RequestBody DocumentRequestDto dto) {
        return DuplicateCheckResponseDto.from(duplicateIdentityService.checkAndFlag(dto.getCpfCnpj(), dto.getUserId()));
    }

    @PostMapping("/devices")
    @Operation(summary = "Record device", description = "Stores the device fingerprint and flags devices shared between accounts.")
    public Map<String, String> recordDevice(@Valid @RequestBody DeviceRequestDto dto) {
        DeviceSignals signals = DeviceSignals.builder()
                .userAgent(dto.getUserAgent())
                .screenResolution(dto.getScreenResolution())
                .timezone(dto.getTimezone())
                .language(dto.getLanguage())
                .ipAddress(dto.getIpAddress())
                .build();
        return Map.of("fingerprint", deviceFingerprintService.recordDeviceFingerprint(dto.getUserId(), signals));
    }
}
