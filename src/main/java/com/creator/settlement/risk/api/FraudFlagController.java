package com.creator.settlement.risk.api;

import com.creator.settlement.api.PageDto;
import com.creator.settlement.risk.domain.FraudFlagFilter;
import com.creator.settlement.risk.domain.FraudFlagType;
import com.creator.settlement.risk.domain.NewFraudFlag;
import com.creator.settlement.risk.flags.FraudFlagRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Back-office access to fraud flags. Review queue is ordered by severity, then recency.
 */
@Validated
@RestController
@RequestMapping("/api/v1/risk/fraud-flags")
@RequiredArgsConstructor
@Tag(name = "Fraud flags", description = "List, raise and resolve fraud flags")
public class FraudFlagController {

    private final FraudFlagRegistry fraudFlagRegistry;

    @GetMapping
    @Operation(summary = "List fraud flags", description = "Filter by resolved state and type; most severe first.")
    public PageDto<FraudFlagDto> list(@RequestParam(required = false) Boolean resolved,
                                      @RequestParam(required = false) FraudFlagType type,
                                      @RequestParam(defaultValue = "0") @Min(0) int page,
                                      @RequestParam(defaultValue = "20") @Min(1) @Max(100) int size) {
        FraudFlagFilter filter = FraudFlagFilter.builder().resolved(resolved).type(type).build();
        return PageDto.from(fraudFlagRegistry.list(filter, PageRequest.of(page, size)), FraudFlagDto::from);
    }

    @GetMapping("/unresolved/count")
    @Operation(summary = "Count unresolved flags")
    public Map<String, Long> countUnresolved() {
        return Map.of("unresolved", fraudFlagRegistry.countUnresolved());
    }

    @PostMapping
    @Operation(summary = "Raise fraud flag")
    public ResponseEntity<FraudFlagDto> create(@Valid @RequestBody CreateFraudFlagRequestDto dto) {
        NewFraudFlag flag = NewFraudFlag.builder()
                .userId(dto.getUserId())
                .creatorId(dto.getCreatorId())
                .type(dto.getType())
                .severity(dto.getSeverity())
                .description(dto.getDescription())
                .metadata(dto.getMetadata())
                .build();
        return ResponseEntity.status(HttpStatus.CREATED).body(FraudFlagDto.from(fraudFlagRegistry.create(flag)));
    }

    @PostMapping("/{flagId}/resolve")
    @Operation(summary = "Resolve fraud flag", description = "Fails with 409 when the flag is already resolved.")
    public FraudFlagDto resolve(@PathVariable String flagId, @Valid @RequestBody ResolveFraudFlagRequestDto dto) {
        return FraudFlagDto.from(fraudFlagRegistry.resolve(flagId, dto.getResolverId(), dto.getResolution()));
    }
}
