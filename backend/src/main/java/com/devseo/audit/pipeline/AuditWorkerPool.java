package com.devseo.audit.pipeline;

import com.devseo.audit.config.AuditProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed set of worker threads draining {@link AuditJobQueue}. Each worker runs one job at a time
 * and takes the next one as soon as the current job settles.
 */
@Service
public class AuditWorkerPool {
    private static final Logger log = LoggerFactory.getLogger(AuditWorkerPool.class);

    private final AuditJobQueue queue;
    private final AuditPipelineService pipeline;
    private final AuditProperties properties;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger activeJobs = new AtomicInteger();
    private final Object lifecycleLock = new Object();

    private ExecutorService executor;
    private int workerCount;

    public AuditWorkerPool(AuditJobQueue queue, AuditPipelineService pipeline, AuditProperties properties) {
        this.queue = queue;
        this.pipeline = pipeline;
        this.properties = properties;
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.getWorker().isAutoStart()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            workerCount = properties.getWorker().getConcurrency();
            AtomicInteger threadIndex = new AtomicInteger();
            executor = Executors.newFixedThreadPool(workerCount, runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("audit-worker-" + threadIndex.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            });
            running.set(true);
            for (int i = 0; i < workerCount; i++) {
                int workerIndex = i + 1;
                executor.submit(() -> workerLoop(workerIndex));
            }
            log.info("Audit worker pool started with concurrency {}", workerCount);
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            running.set(false);
            if (executor != null) {
                executor.shutdownNow();
                try {
                    executor.awaitTermination(5, TimeUnit.SECONDS);
                } catch (InterruptedException ignored) {
                    Thread.currentThread().interrupt();
                }
                executor = null;
            }
            workerCount = 0;
        }
    }

    public WorkerStatus status() {
        return new WorkerStatus(running.get(), workerCount, activeJobs.get(), queue.size());
    }

    private void workerLoop(int workerIndex) {
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            AuditJob job;
            try {
                job = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            activeJobs.incrementAndGet();
            try {
                pipeline.process(job);
            } catch (Exception e) {
                log.warn("Audit worker {} failed while processing audit #{}", workerIndex, job.auditId(), e);
            } finally {
                activeJobs.decrementAndGet();
            }
        }
        log.debug("Audit worker {} stopped", workerIndex);
    }

    public record WorkerStatus(boolean running, int concurrency, int activeJobs, int queued) {
    }
}
