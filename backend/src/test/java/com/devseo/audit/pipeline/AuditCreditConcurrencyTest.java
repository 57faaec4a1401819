package com.devseo.audit.pipeline;

import com.devseo.audit.persistence.AuditJdbcRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class AuditCreditConcurrencyTest {

    @Autowired
    private AuditSubmissionService submissionService;

    @Autowired
    private AuditJdbcRepository repository;

    @Autowired
    private AuditJobQueue queue;

    private final ExecutorService executor = Executors.newFixedThreadPool(8);

    @AfterEach
    void tearDown() throws Exception {
        executor.shutdownNow();
        executor.awaitTermination(5, TimeUnit.SECONDS);
        AuditJob leftover = queue.dequeue();
        while (leftover != null) {
            leftover = queue.dequeue();
        }
    }

    @Test
    void concurrentSubmitsCannotSpendTheLastCreditTwice() throws Exception {
        String userId = "user-" + UUID.randomUUID();
        repository.ensureProfile(userId);
        repository.adjustProfileCredits(userId, 1 - AuditJdbcRepository.DEFAULT_CREDITS);

        List<Callable<Boolean>> submits = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            String url = "https://race" + i + ".example";
            submits.add(() -> {
                try {
                    submissionService.submit(userId, url);
                    return true;
                } catch (InsufficientCreditsException e) {
                    return false;
                }
            });
        }

        List<Boolean> outcomes = runTogether(submits);

        assertThat(outcomes).containsOnlyOnce(true);
        assertThat(repository.findProfile(userId).credits()).isZero();
        assertThat(repository.findAuditsByUser(userId)).hasSize(1);
        assertThat(repository.findCreditTransactions(userId)).hasSize(1);
    }

    @Test
    void refundsLandingDuringSubmitsAreNotLost() throws Exception {
        String userId = "user-" + UUID.randomUUID();
        repository.ensureProfile(userId);
        repository.adjustProfileCredits(userId, 5 - AuditJdbcRepository.DEFAULT_CREDITS);

        List<Callable<Boolean>> tasks = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            String url = "https://busy" + i + ".example";
            tasks.add(() -> submissionService.submit(userId, url) != null);
            tasks.add(() -> repository.adjustProfileCredits(userId, 1));
        }

        List<Boolean> outcomes = runTogether(tasks);

        assertThat(outcomes).containsOnly(true);
        assertThat(repository.findAuditsByUser(userId)).hasSize(5);
        assertThat(repository.findProfile(userId).credits()).isEqualTo(5);
    }

    private List<Boolean> runTogether(List<Callable<Boolean>> tasks) throws InterruptedException, ExecutionException {
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> futures = new ArrayList<>();
        for (Callable<Boolean> task : tasks) {
            futures.add(executor.submit(() -> {
                start.await();
                return task.call();
            }));
        }
        start.countDown();
        List<Boolean> outcomes = new ArrayList<>();
        for (Future<Boolean> future : futures) {
            try {
                outcomes.add(future.get(10, TimeUnit.SECONDS));
            } catch (TimeoutException e) {
                throw new AssertionError("Credit update did not finish", e);
            }
        }
        return outcomes;
    }
}
