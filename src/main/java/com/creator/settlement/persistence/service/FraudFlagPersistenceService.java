package com.creator.settlement.persistence.service;

import com.creator.settlement.persistence.entity.FraudFlagEntity;
import com.creator.settlement.persistence.repository.FraudFlagRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Persists fraud flags in their own transaction, so a flag raised while rejecting a request
 * survives that request's rollback, and a failed flag insert cannot roll back the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FraudFlagPersistenceService {

    private final FraudFlagRepository flagRepository;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public FraudFlagEntity persist(FraudFlagEntity flag) {
        FraudFlagEntity saved = flagRepository.save(flag);
        log.debug("Persisted fraud flag: flagId={}, type={}, severity={}",
                saved.getId(), saved.getType(), saved.getSeverity());
        return saved;
    }
}
