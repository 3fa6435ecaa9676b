package com.creator.settlement.core;

import com.creator.settlement.api.ReconciliationRequiredException;
import com.creator.settlement.api.SettlementException;
import com.creator.settlement.compliance.SettlementAuditLogger;
import com.creator.settlement.domain.BalanceSnapshot;
import com.creator.settlement.domain.BalanceSummary;
import com.creator.settlement.domain.ErrorKind;
import com.creator.settlement.domain.KycStatus;
import com.creator.settlement.domain.PayoutLimitInfo;
import com.creator.settlement.domain.PayoutQuote;
import com.creator.settlement.domain.PayoutStatus;
import com.creator.settlement.domain.TransferRequest;
import com.creator.settlement.domain.TransferResult;
import com.creator.settlement.messaging.SettlementEventProducer;
import com.creator.settlement.persistence.entity.CreatorEntity;
import com.creator.settlement.persistence.entity.PayoutEntity;
import com.creator.settlement.persistence.repository.CreatorRepository;
import com.creator.settlement.persistence.repository.PayoutRepository;
import com.creator.settlement.persistence.service.PayoutPersistenceService;
import com.creator.settlement.risk.domain.FraudFlagType;
import com.creator.settlement.risk.domain.NewFraudFlag;
import com.creator.settlement.risk.domain.VelocityCheckResult;
import com.creator.settlement.risk.domain.VelocityKind;
import com.creator.settlement.risk.flags.FraudFlagRegistry;
import com.creator.settlement.risk.identity.PixKeyTypeDetector;
import com.creator.settlement.risk.velocity.VelocityGuard;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Turns a creator's available balance into a PIX transfer.
 * <p>
 * A request is validated completely before anything is written. Execution is a saga: one local
 * transaction opens the payout and debits the ledger, the gateway is called outside any
 * transaction, and any failure after the debit runs the compensating credit before the error
 * reaches the caller. Requests for the same creator are serialized by {@link PayoutLockService}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PayoutOrchestrator {

    static final String CIRCUIT_BREAKER = "settlement-gateway";
    static final int VELOCITY_FLAG_SEVERITY = 3;
    private static final Duration MONTHLY_WINDOW = Duration.ofDays(30);

    private final CreatorRepository creatorRepository;
    private final PayoutRepository payoutRepository;
    private final LedgerService ledgerService;
    private final PayoutPersistenceService persistenceService;
    private final VelocityGuard velocityGuard;
    private final FraudFlagRegistry fraudFlagRegistry;
    private final PayoutLockService payoutLockService;
    private final SettlementGateway settlementGateway;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final SettlementAuditLogger auditLogger;
    private final SettlementEventProducer eventProducer;

    @Value("${settlement.payout.min-amount:2000}")
    private long minPayoutAmount;

    @Value("${settlement.payout.fee:199}")
    private long payoutFee;

    @Value("${settlement.payout.min-net-amount:100}")
    private long minNetAmount;

    @Value("${settlement.payout.monthly-limit.standard:4}")
    private int standardMonthlyLimit;

    @Value("${settlement.payout.monthly-limit.pro:8}")
    private int proMonthlyLimit;

    @Value("${settlement.payout.velocity.window-minutes:60}")
    private int velocityWindowMinutes;

    @Value("${settlement.payout.velocity.limit:3}")
    private int velocityLimit;

    /**
     * Requests a payout of {@code amount} minor units, or of the whole available balance when
     * {@code amount} is null.
     *
     * @return the payout, COMPLETED when the gateway settled immediately, otherwise PROCESSING
     * @throws SettlementException with EXTERNAL_GATEWAY_ERROR after a failed transfer (funds returned),
     *                             or one of the validation kinds before anything was written
     * @throws ReconciliationRequiredException when the ledger could not be made consistent
     */
    public PayoutEntity requestPayout(String creatorId, Long amount) {
        return payoutLockService.withCreatorLock(creatorId, () -> executePayout(creatorId, amount));
    }

    private PayoutEntity executePayout(String creatorId, Long amount) {
        CreatorEntity creator = creatorRepository.findById(creatorId)
                .orElseThrow(() -> SettlementException.notFound("Creator", creatorId));
        validateEligibility(creator);

        BalanceSnapshot balance = ledgerService.getBalance(creatorId);
        PayoutQuote quote = quote(amount, balance.getAvailable());

        PayoutEntity payout = persistenceService.openPayout(creatorId, quote);

        // Funds are debited from here on: any failure before the gateway answers is compensated
        TransferResult transfer;
        try {
            auditLogger.logPayoutRequested(payout, creator.getPixKey());
            eventProducer.publishPayoutRequested(payout);

            TransferRequest transferRequest = TransferRequest.builder()
                    .amountDecimal(BigDecimal.valueOf(quote.getNet()).movePointLeft(2).setScale(2, RoundingMode.UNNECESSARY))
                    .destinationKey(creator.getPixKey())
                    .destinationKeyType(PixKeyTypeDetector.resolve(creator.getPixKey(), creator.getPixKeyType()))
                    .description("Creator payout")
                    .externalReference(payout.getId())
                    .build();
            CircuitBreaker cb = circuitBreakerRegistry.circuitBreaker(CIRCUIT_BREAKER);
            transfer = cb.executeSupplier(() -> settlementGateway.transfer(transferRequest));
        } catch (RuntimeException e) {
            log.error("Transfer failed for payoutId={} creatorId={} gateway={}",
                    payout.getId(), creatorId, settlementGateway.getName(), e);
            throw compensateAndFail(payout, describeFailure(e), e);
        }
        if (transfer == null || transfer.isRejected()) {
            String reason = transfer == null
                    ? "Empty response from settlement gateway"
                    : "Transfer " + transfer.getId() + " rejected with status " + transfer.getRawStatus();
            log.error("Transfer rejected for payoutId={} creatorId={}: {}", payout.getId(), creatorId, reason);
            throw compensateAndFail(payout, reason, null);
        }

        PayoutEntity recorded;
        try {
            recorded = persistenceService.recordTransfer(payout.getId(), transfer);
        } catch (RuntimeException e) {
            // Money has left through the gateway: compensating here would pay twice
            log.error("Transfer {} submitted for payoutId={} but could not be recorded, manual reconciliation required",
                    transfer.getId(), payout.getId(), e);
            throw new ReconciliationRequiredException(payout.getId(),
                    "Payout submitted but its state could not be recorded", e);
        }
        log.info("Payout submitted: payoutId={} creatorId={} transferId={} status={}",
                recorded.getId(), creatorId, recorded.getExternalTransferId(), recorded.getStatus());
        auditLogger.logPayoutResult(recorded);
        eventProducer.publishPayoutResult(recorded);
        return recorded;
    }

    /**
     * Steps 2-6 of the request checks, in order. The first failing check decides the error.
     */
    private void validateEligibility(CreatorEntity creator) {
        String creatorId = creator.getId();
        if (creator.getKycStatus() != KycStatus.APPROVED) {
            log.warn("Payout rejected for creatorId={}: KYC status {}", creatorId, creator.getKycStatus());
            throw new SettlementException(ErrorKind.KYC_REQUIRED, "KYC_REQUIRED",
                    "Identity verification must be approved before requesting payouts");
        }
        if (creator.isPayoutsBlocked()) {
            log.warn("Payout rejected for creatorId={}: payouts blocked ({})", creatorId, creator.getPayoutBlockReason());
            throw new SettlementException(ErrorKind.PAYOUTS_BLOCKED, "PAYOUTS_BLOCKED",
                    "Payouts are blocked: " + (creator.getPayoutBlockReason() != null ? creator.getPayoutBlockReason() : "no reason given"));
        }
        if (creator.getPixKey() == null || creator.getPixKey().isBlank()) {
            throw SettlementException.validation("PIX_KEY_MISSING", "Configure a PIX key before requesting payouts");
        }

        VelocityCheckResult velocity = velocityGuard.checkVelocity(VelocityKind.PAYOUT, creator.getUserId(),
                velocityWindowMinutes, velocityLimit);
        if (!velocity.isAllowed()) {
            Map<String, Object> metadata = new HashMap<>();
            metadata.put("count", velocity.getCount());
            metadata.put("limit", velocity.getLimit());
            metadata.put("windowMinutes", velocity.getWindowMinutes());
            fraudFlagRegistry.raise(NewFraudFlag.builder()
                    .userId(creator.getUserId())
                    .creatorId(creatorId)
                    .type(FraudFlagType.VELOCITY_PAYOUT)
                    .severity(VELOCITY_FLAG_SEVERITY)
                    .description("Payout velocity exceeded: " + velocity.getCount() + " payouts in "
                            + velocity.getWindowMinutes() + " minutes")
                    .metadata(metadata)
                    .build());
            throw new SettlementException(ErrorKind.RATE_LIMITED, "VELOCITY_EXCEEDED",
                    "Too many payout requests, try again later");
        }

        PayoutLimitInfo limit = limitInfo(creator);
        if (limit.getRemaining() <= 0) {
            log.warn("Payout rejected for creatorId={}: monthly limit reached ({}/{})",
                    creatorId, limit.getUsed(), limit.getLimit());
            throw new SettlementException(ErrorKind.RATE_LIMITED, "MONTHLY_LIMIT_REACHED",
                    "Monthly payout limit of " + limit.getLimit() + " reached");
        }
    }

    /**
     * Resolves gross, fee and net for a request. {@code requested} null means the whole balance.
     */
    PayoutQuote quote(Long requested, long available) {
        if (requested != null && requested <= 0) {
            throw SettlementException.validation("INVALID_AMOUNT", "Payout amount must be positive");
        }
        long gross = requested != null ? requested : available;
        if (gross > available) {
            throw new SettlementException(ErrorKind.INSUFFICIENT_FUNDS, "INSUFFICIENT_FUNDS",
                    "Insufficient available balance");
        }
        if (gross < minPayoutAmount) {
            throw new SettlementException(ErrorKind.BELOW_MINIMUM, "BELOW_MINIMUM",
                    "Minimum payout is R$ " + formatReais(minPayoutAmount));
        }
        long net = gross - payoutFee;
        if (net < minNetAmount) {
            throw new SettlementException(ErrorKind.BELOW_MINIMUM, "NET_TOO_LOW",
                    "Amount after the R$ " + formatReais(payoutFee) + " fee is below R$ " + formatReais(minNetAmount));
        }
        return new PayoutQuote(gross, payoutFee, net);
    }

    /**
     * Runs the compensation and returns the error to throw. A compensation that cannot be written
     * is surfaced as {@link ReconciliationRequiredException} instead.
     */
    private SettlementException compensateAndFail(PayoutEntity payout, String reason, RuntimeException cause) {
        try {
            persistenceService.compensateFailedPayout(payout.getId(), reason);
        } catch (RuntimeException compensationError) {
            log.error("Compensation failed for payoutId={} creatorId={} gross={}: ledger debited for a failed transfer",
                    payout.getId(), payout.getCreatorId(), payout.getAmount(), compensationError);
            ReconciliationRequiredException reconciliation = new ReconciliationRequiredException(payout.getId(),
                    "Payout failed and funds could not be returned automatically", compensationError);
            if (cause != null) {
                reconciliation.addSuppressed(cause);
            }
            return reconciliation;
        }
        payout.setStatus(PayoutStatus.FAILED);
        payout.setFailedReason(reason);
        auditLogger.logPayoutResult(payout);
        eventProducer.publishPayoutResult(payout);
        return new SettlementException(ErrorKind.EXTERNAL_GATEWAY_ERROR, "PAYOUT_FAILED",
                "Payout failed, funds returned", cause);
    }

    /**
     * Settles a PROCESSING payout from the gateway's view of its transfer: DONE completes it,
     * CANCELLED or FAILED compensates it. Other payouts are returned unchanged.
     */
    public PayoutEntity reconcile(String payoutId) {
        PayoutEntity payout = persistenceService.getPayout(payoutId);
        if (payout.getStatus() != PayoutStatus.PROCESSING) {
            return payout;
        }
        if (payout.getExternalTransferId() == null) {
            throw SettlementException.invalidState("TRANSFER_UNKNOWN",
                    "Payout has no gateway transfer to reconcile against");
        }

        TransferResult transfer;
        try {
            CircuitBreaker cb = circuitBreakerRegistry.circuitBreaker(CIRCUIT_BREAKER);
            transfer = cb.executeSupplier(() -> settlementGateway.getTransfer(payout.getExternalTransferId()));
        } catch (RuntimeException e) {
            log.error("Transfer lookup failed for payoutId={} transferId={}", payoutId, payout.getExternalTransferId(), e);
            throw new SettlementException(ErrorKind.EXTERNAL_GATEWAY_ERROR, "TRANSFER_LOOKUP_FAILED",
                    "Could not query the transfer status", e);
        }

        boolean changed = false;
        if (transfer.isSettled()) {
            changed = persistenceService.markCompleted(payoutId);
        } else if (transfer.isRejected()) {
            changed = persistenceService.compensateFailedPayout(payoutId,
                    "Transfer " + transfer.getId() + " ended with status " + transfer.getRawStatus());
        }
        PayoutEntity current = persistenceService.getPayout(payoutId);
        if (changed) {
            log.info("Payout reconciled: payoutId={} status={}", payoutId, current.getStatus());
            auditLogger.logPayoutResult(current);
            eventProducer.publishPayoutResult(current);
        }
        return current;
    }

    public PayoutLimitInfo getPayoutLimitInfo(String creatorId) {
        CreatorEntity creator = creatorRepository.findById(creatorId)
                .orElseThrow(() -> SettlementException.notFound("Creator", creatorId));
        return limitInfo(creator);
    }

    public BalanceSummary getBalanceSummary(String creatorId) {
        PayoutLimitInfo limit = getPayoutLimitInfo(creatorId);
        BalanceSnapshot balance = ledgerService.getBalance(creatorId);
        return BalanceSummary.builder()
                .available(balance.getAvailable())
                .pending(balance.getPending())
                .minPayout(minPayoutAmount)
                .payoutFee(payoutFee)
                .netAvailable(Math.max(0, balance.getAvailable() - payoutFee))
                .payoutLimit(limit)
                .build();
    }

    public Page<PayoutEntity> listPayouts(String creatorId, PayoutStatus status, Pageable pageable) {
        if (status != null) {
            return payoutRepository.findByCreatorIdAndStatusOrderByCreatedAtDesc(creatorId, status, pageable);
        }
        return payoutRepository.findByCreatorIdOrderByCreatedAtDesc(creatorId, pageable);
    }

    public PayoutEntity getPayout(String payoutId) {
        return persistenceService.getPayout(payoutId);
    }

    // FAILED payouts do not count against the allowance
    private PayoutLimitInfo limitInfo(CreatorEntity creator) {
        Instant since = Instant.now().minus(MONTHLY_WINDOW);
        long used = payoutRepository.countByCreatorIdAndCreatedAtGreaterThanEqualAndStatusNot(
                creator.getId(), since, PayoutStatus.FAILED);
        int limit = creator.isPro() ? proMonthlyLimit : standardMonthlyLimit;
        return PayoutLimitInfo.builder()
                .used(used)
                .limit(limit)
                .remaining(Math.max(0, limit - used))
                .pro(creator.isPro())
                .build();
    }

    private static String describeFailure(RuntimeException e) {
        if (e instanceof CallNotPermittedException) {
            return "Settlement gateway unavailable (circuit open)";
        }
        return e.getClass().getSimpleName() + (e.getMessage() != null ? ": " + e.getMessage() : "");
    }

    private static String formatReais(long minorUnits) {
        return String.format(Locale.ROOT, "%.2f", minorUnits / 100.0);
    }
}
