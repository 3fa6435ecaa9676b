package com.creator.settlement.risk.flags;

import com.creator.settlement.api.SettlementException;
import com.creator.settlement.messaging.SettlementEventProducer;
import com.creator.settlement.persistence.entity.FraudFlagEntity;
import com.creator.settlement.persistence.repository.FraudFlagRepository;
import com.creator.settlement.persistence.service.FraudFlagPersistenceService;
import com.creator.settlement.risk.domain.FraudFlagFilter;
import com.creator.settlement.risk.domain.NewFraudFlag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.HashMap;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only registry of advisory fraud signals. Other components only raise flags;
 * resolving them is a back-office action.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FraudFlagRegistry {

    static final int MIN_SEVERITY = 1;
    static final int MAX_SEVERITY = 5;

    private final FraudFlagPersistenceService persistenceService;
    private final FraudFlagRepository flagRepository;
    private final SettlementEventProducer eventProducer;

    /**
     * Inserts a flag with severity clamped to 1..5. Failures propagate.
     */
    public FraudFlagEntity create(NewFraudFlag flag) {
        if (flag.getType() == null) {
            throw SettlementException.validation("FLAG_TYPE_REQUIRED", "Fraud flag type is required");
        }
        FraudFlagEntity saved = persistenceService.persist(FraudFlagEntity.builder()
                .id(UUID.randomUUID().toString())
                .userId(flag.getUserId())
                .creatorId(flag.getCreatorId())
                .type(flag.getType())
                .severity(clampSeverity(flag.getSeverity()))
                .description(flag.getDescription())
                .metadata(flag.getMetadata() != null ? new HashMap<>(flag.getMetadata()) : new HashMap<>())
                .build());
        log.info("Fraud flag raised: flagId={} type={} severity={} userId={} creatorId={}",
                saved.getId(), saved.getType(), saved.getSeverity(), saved.getUserId(), saved.getCreatorId());
        eventProducer.publishFraudFlag(saved);
        return saved;
    }

    /**
     * Best-effort {@link #create}: a failure is logged and never reaches the caller, so raising a
     * flag cannot block the operation that detected the signal.
     */
    public Optional<FraudFlagEntity> raise(NewFraudFlag flag) {
        try {
            return Optional.of(create(flag));
        } catch (Exception e) {
            log.error("Failed to raise fraud flag type={} userId={} creatorId={}",
                    flag.getType(), flag.getUserId(), flag.getCreatorId(), e);
            return Optional.empty();
        }
    }

    @Transactional
    public FraudFlagEntity resolve(String flagId, String resolverId, String resolution) {
        FraudFlagEntity flag = flagRepository.findById(flagId)
                .orElseThrow(() -> SettlementException.notFound("Fraud flag", flagId));
        if (flag.isResolved()) {
            throw SettlementException.invalidState("FLAG_ALREADY_RESOLVED", "Fraud flag already resolved");
        }
        flag.setResolved(true);
        flag.setResolvedBy(resolverId);
        flag.setResolution(resolution);
        flag.setResolvedAt(Instant.now());
        FraudFlagEntity saved = flagRepository.save(flag);
        log.info("Fraud flag resolved: flagId={} resolvedBy={}", flagId, resolverId);
        return saved;
    }

    /**
     * Flags matching the filter, most severe first, newest first within a severity.
     */
    @Transactional(readOnly = true)
    public Page<FraudFlagEntity> list(FraudFlagFilter filter, Pageable pageable) {
        FraudFlagFilter effective = filter != null ? filter : FraudFlagFilter.all();
        return flagRepository.search(effective.getResolved(), effective.getType(), pageable);
    }

    @Transactional(readOnly = true)
    public long countUnresolved() {
        return flagRepository.countByResolvedFalse();
    }

    static int clampSeverity(int severity) {
        return Math.max(MIN_SEVERITY, Math.min(MAX_SEVERITY, severity));
    }
}
