package com.creator.settlement.risk.identity;

import com.creator.settlement.api.SettlementException;
import com.creator.settlement.compliance.SensitiveDataMasker;
import com.creator.settlement.persistence.repository.CreatorRepository;
import com.creator.settlement.persistence.repository.UserAccountRepository;
import com.creator.settlement.risk.domain.DocumentValidation;
import com.creator.settlement.risk.domain.DuplicateIdentity;
import com.creator.settlement.risk.domain.FraudFlagType;
import com.creator.settlement.risk.domain.NewFraudFlag;
import com.creator.settlement.risk.flags.FraudFlagRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Finds other accounts registered with the same CPF/CNPJ. Stored values may be formatted or
 * bare digits, so both forms are matched.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DuplicateIdentityService {

    static final int DUPLICATE_SEVERITY = 4;

    private final UserAccountRepository userRepository;
    private final CreatorRepository creatorRepository;
    private final FraudFlagRegistry fraudFlagRegistry;

    /**
     * Looks in users first, then creators.
     *
     * @param excludeUserId the requesting user, never reported as its own duplicate; may be null
     */
    @Transactional(readOnly = true)
    public Optional<DuplicateIdentity> findDuplicate(String cpfCnpj, String excludeUserId) {
        Set<String> candidates = candidates(cpfCnpj);
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        Optional<DuplicateIdentity> user = (excludeUserId != null
                ? userRepository.findFirstByCpfCnpjInAndIdNot(candidates, excludeUserId)
                : userRepository.findFirstByCpfCnpjIn(candidates))
                .map(u -> new DuplicateIdentity(u.getId(), null));
        if (user.isPresent()) {
            return user;
        }
        return (excludeUserId != null
                ? creatorRepository.findFirstByCpfCnpjInAndUserIdNot(candidates, excludeUserId)
                : creatorRepository.findFirstByCpfCnpjIn(candidates))
                .map(c -> new DuplicateIdentity(c.getUserId(), c.getId()));
    }

    /**
     * Validates the document and raises a DUPLICATE_IDENTITY flag when another account holds it.
     * Malformed documents fail with VALIDATION_FAILED.
     */
    public Optional<DuplicateIdentity> checkAndFlag(String cpfCnpj, String userId) {
        DocumentValidation validation = TaxIdValidator.validate(cpfCnpj);
        if (!validation.isValid()) {
            throw SettlementException.validation("INVALID_DOCUMENT", "Invalid CPF/CNPJ");
        }
        Optional<DuplicateIdentity> duplicate = findDuplicate(cpfCnpj, userId);
        duplicate.ifPresent(match -> {
            log.warn("Duplicate identity: userId={} document={} alreadyHeldBy={}",
                    userId, SensitiveDataMasker.maskTaxId(cpfCnpj), match.getUserId());
            Map<String, Object> metadata = new HashMap<>();
            metadata.put("existingUserId", match.getUserId());
            if (match.getCreatorId() != null) {
                metadata.put("existingCreatorId", match.getCreatorId());
            }
            metadata.put("documentType", validation.getType().name());
            fraudFlagRegistry.raise(NewFraudFlag.builder()
                    .userId(userId)
                    .type(FraudFlagType.DUPLICATE_IDENTITY)
                    .severity(DUPLICATE_SEVERITY)
                    .description("Tax id already registered to another account")
                    .metadata(metadata)
                    .build());
        });
        return duplicate;
    }

    private static Set<String> candidates(String cpfCnpj) {
        Set<String> values = new LinkedHashSet<>();
        String normalized = TaxIdValidator.normalize(cpfCnpj);
        if (!normalized.isEmpty()) {
            values.add(normalized);
        }
        if (cpfCnpj != null && !cpfCnpj.isBlank()) {
            values.add(cpfCnpj.trim());
        }
        return values;
    }
}
