package com.creator.settlement.core;

import com.creator.settlement.api.SettlementException;
import com.creator.settlement.compliance.SettlementAuditLogger;
import com.creator.settlement.domain.ErrorKind;
import com.creator.settlement.persistence.entity.CreatorEntity;
import com.creator.settlement.persistence.repository.CreatorRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PayoutBlockServiceTest {

    @Mock
    private CreatorRepository creatorRepository;

    @Mock
    private SettlementAuditLogger auditLogger;

    @InjectMocks
    private PayoutBlockService blockService;

    @Test
    void blockRecordsReasonAndAudits() {
        CreatorEntity creator = CreatorEntity.builder().id("c-1").userId("u-1").build();
        when(creatorRepository.findById("c-1")).thenReturn(Optional.of(creator));
        when(creatorRepository.save(any())).thenAnswer(invocation -> invocation.getArgument(0));

        CreatorEntity blocked = blockService.blockPayouts("c-1", "KYC document under review", "admin-1");

        assertThat(blocked.isPayoutsBlocked()).isTrue();
        assertThat(blocked.getPayoutBlockReason()).isEqualTo("KYC document under review");
        verify(auditLogger).logPayoutBlockChange("c-1", true, "KYC document under review", "admin-1");
    }

    @Test
    void blockRequiresReason() {
        assertThatThrownBy(() -> blockService.blockPayouts("c-1", " ", "admin-1"))
                .isInstanceOf(SettlementException.class)
                .extracting(e -> ((SettlementException) e).getKind())
                .isEqualTo(ErrorKind.VALIDATION_FAILED);
        verifyNoInteractions(creatorRepository, auditLogger);
    }

    @Test
    void blockingTwiceIsInvalidState() {
        CreatorEntity creator = CreatorEntity.builder().id("c-1").payoutsBlocked(true).payoutBlockReason("first").build();
        when(creatorRepository.findById("c-1")).thenReturn(Optional.of(creator));

        assertThatThrownBy(() -> blockService.blockPayouts("c-1", "second", "admin-1"))
                .isInstanceOf(SettlementException.class)
                .extracting(e -> ((SettlementException) e).getKind())
                .isEqualTo(ErrorKind.INVALID_STATE);
        assertThat(creator.getPayoutBlockReason()).isEqualTo("first");
    }

    @Test
    void unblockClearsReason() {
        CreatorEntity creator = CreatorEntity.builder().id("c-1").payoutsBlocked(true).payoutBlockReason("multiple chargebacks").build();
        when(creatorRepository.findById("c-1")).thenReturn(Optional.of(creator));
        when(creatorRepository.save(any())).thenAnswer(invocation -> invocation.getArgument(0));

        CreatorEntity unblocked = blockService.unblockPayouts("c-1", "admin-1");

        assertThat(unblocked.isPayoutsBlocked()).isFalse();
        assertThat(unblocked.getPayoutBlockReason()).isNull();
        verify(auditLogger).logPayoutBlockChange("c-1", false, "multiple chargebacks", "admin-1");
    }

    @Test
    void unblockingUnblockedCreatorIsInvalidState() {
        when(creatorRepository.findById("c-1")).thenReturn(Optional.of(CreatorEntity.builder().id("c-1").build()));

        assertThatThrownBy(() -> blockService.unblockPayouts("c-1", "admin-1"))
                .isInstanceOf(SettlementException.class);
        verify(creatorRepository, never()).save(any());
    }

    @Test
    void unknownCreatorIsNotFound() {
        when(creatorRepository.findById("ghost")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> blockService.unblockPayouts("ghost", "admin-1"))
                .isInstanceOf(SettlementException.class)
                .extracting(e -> ((SettlementException) e).getKind())
                .isEqualTo(ErrorKind.NOT_FOUND);
    }
}
