package com.devseo.audit.pipeline;

import com.devseo.audit.config.AuditProperties;
import com.devseo.audit.persistence.AuditJdbcRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

class AuditWorkerPoolTest {
    private AuditJobQueue queue;
    private AuditPipelineService pipeline;
    private AuditProperties properties;
    private AuditWorkerPool pool;

    @BeforeEach
    void setUp() {
        properties = new AuditProperties();
        properties.getWorker().setConcurrency(2);
        properties.getWorker().setAutoStart(false);
        queue = new AuditJobQueue(mock(AuditJdbcRepository.class), properties, Clock.systemUTC());
        pipeline = mock(AuditPipelineService.class);
        pool = new AuditWorkerPool(queue, pipeline, properties);
    }

    @AfterEach
    void tearDown() {
        pool.stop();
    }

    @Test
    void processesEveryJobWithBoundedConcurrency() throws Exception {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        Set<Long> processed = ConcurrentHashMap.newKeySet();
        CountDownLatch finished = new CountDownLatch(5);
        doAnswer(invocation -> {
            AuditJob job = invocation.getArgument(0);
            int now = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(now, Math::max);
            Thread.sleep(50);
            processed.add(job.auditId());
            inFlight.decrementAndGet();
            finished.countDown();
            return null;
        }).when(pipeline).process(any());

        pool.start();
        for (long id = 1; id <= 5; id++) {
            queue.enqueue(new AuditJob(id, "user-1", "https://example.com/" + id, "example.com"));
        }

        assertThat(finished.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(processed).containsExactlyInAnyOrder(1L, 2L, 3L, 4L, 5L);
        assertThat(maxInFlight.get()).isLessThanOrEqualTo(2);
        assertThat(queue.size()).isZero();
    }

    @Test
    void workerSurvivesJobThatThrows() throws Exception {
        CountDownLatch secondJob = new CountDownLatch(1);
        doThrow(new IllegalStateException("boom"))
            .doAnswer(invocation -> {
                secondJob.countDown();
                return null;
            })
            .when(pipeline).process(any());
        properties.getWorker().setConcurrency(1);

        pool.start();
        queue.enqueue(new AuditJob(1, "user-1", "https://example.com", "example.com"));
        queue.enqueue(new AuditJob(2, "user-1", "https://example.com", "example.com"));

        assertThat(secondJob.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void reportsStatusAcrossStartAndStop() {
        assertThat(pool.status()).isEqualTo(new AuditWorkerPool.WorkerStatus(false, 0, 0, 0));

        pool.start();
        pool.start();
        assertThat(pool.status().running()).isTrue();
        assertThat(pool.status().concurrency()).isEqualTo(2);

        pool.stop();
        assertThat(pool.status().running()).isFalse();

        queue.enqueue(new AuditJob(9, "user-1", "https://example.com", "example.com"));
        assertThat(pool.status().queued()).isEqualTo(1);
    }

    @Test
    void autoStartFollowsConfiguration() {
        pool.startIfEnabled();
        assertThat(pool.status().running()).isFalse();

        properties.getWorker().setAutoStart(true);
        pool.startIfEnabled();
        assertThat(pool.status().running()).isTrue();
        assertThat(pool.status().concurrency()).isEqualTo(2);
    }
}
