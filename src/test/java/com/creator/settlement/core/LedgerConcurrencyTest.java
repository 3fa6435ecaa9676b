package com.creator.settlement.core;

import com.creator.settlement.persistence.entity.BalanceEntity;
import com.creator.settlement.persistence.repository.BalanceRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoSpyBean;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.doReturn;

/**
 * Ledger against H2 with every call committing on its own, the way requests hit it in production.
 */
@DataJpaTest(properties = "spring.jpa.hibernate.ddl-auto=create-drop")
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import(LedgerService.class)
class LedgerConcurrencyTest {

    private static final int THREADS = 8;

    @Autowired
    private LedgerService ledgerService;

    @MockitoSpyBean
    private BalanceRepository balanceRepository;

    @AfterEach
    void cleanUp() {
        balanceRepository.deleteAll();
    }

    @Test
    void openBalanceLosingInsertRaceIsNoOp() {
        balanceRepository.saveAndFlush(BalanceEntity.builder()
                .id(UUID.randomUUID().toString())
                .creatorId("c-race")
                .available(700)
                .pending(0)
                .build());
        // A concurrent open checked before the winning row was committed
        doReturn(false).when(balanceRepository).existsByCreatorId("c-race");

        assertThatCode(() -> ledgerService.openBalance("c-race")).doesNotThrowAnyException();

        assertThat(balanceRepository.findAll()).hasSize(1);
        assertThat(ledgerService.getBalance("c-race").getAvailable()).isEqualTo(700);
    }

    @Test
    void openBalanceTwiceKeepsOneRow() {
        ledgerService.openBalance("c-1");
        ledgerService.credit("c-1", 300);
        ledgerService.openBalance("c-1");

        assertThat(balanceRepository.findAll()).hasSize(1);
        assertThat(ledgerService.getBalance("c-1").getAvailable()).isEqualTo(300);
    }

    @Test
    void parallelDebitsNeverOverdraw() throws Exception {
        ledgerService.openBalance("c-1");
        ledgerService.credit("c-1", 5000);

        List<Boolean> outcomes = runConcurrently(40, () -> ledgerService.tryDebit("c-1", 300));

        long succeeded = outcomes.stream().filter(Boolean::booleanValue).count();
        assertThat(succeeded).isEqualTo(5000 / 300);
        assertThat(ledgerService.getBalance("c-1").getAvailable()).isEqualTo(5000 - succeeded * 300).isGreaterThanOrEqualTo(0);
    }

    @Test
    void parallelCreditsAndDebitsKeepBalanceConsistent() throws Exception {
        ledgerService.openBalance("c-1");
        ledgerService.credit("c-1", 1000);

        List<Callable<Boolean>> tasks = new ArrayList<>();
        for (int i = 0; i < 60; i++) {
            if (i % 3 == 0) {
                tasks.add(() -> {
                    ledgerService.credit("c-1", 100);
                    return null;
                });
            } else {
                tasks.add(() -> ledgerService.tryDebit("c-1", 250));
            }
        }
        List<Boolean> outcomes = runConcurrently(tasks);

        long debited = outcomes.stream().filter(Boolean.TRUE::equals).count() * 250;
        long available = ledgerService.getBalance("c-1").getAvailable();
        assertThat(available).isGreaterThanOrEqualTo(0);
        assertThat(available).isEqualTo(1000 + 20 * 100 - debited);
    }

    private static <T> List<T> runConcurrently(int count, Callable<T> task) throws Exception {
        List<Callable<T>> tasks = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            tasks.add(task);
        }
        return runConcurrently(tasks);
    }

    private static <T> List<T> runConcurrently(List<Callable<T>> tasks) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<T>> futures = new ArrayList<>();
            for (Callable<T> task : tasks) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return task.call();
                }));
            }
            start.countDown();
            List<T> results = new ArrayList<>();
            for (Future<T> future : futures) {
                results.add(future.get(30, TimeUnit.SECONDS));
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }
}
