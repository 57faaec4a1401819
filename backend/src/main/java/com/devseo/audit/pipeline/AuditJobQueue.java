package com.devseo.audit.pipeline;

import com.devseo.audit.config.AuditProperties;
import com.devseo.audit.persistence.AuditJdbcRepository;
import com.devseo.audit.persistence.AuditStatus;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-local FIFO of audit jobs plus the live progress of every in-flight audit.
 * Progress in a terminal stage is kept for {@code audit.queue.progress-retention} and
 * then dropped the next time progress is read or written.
 */
@Component
public class AuditJobQueue {
    private final AuditJdbcRepository repository;
    private final Clock clock;
    private final Duration progressRetention;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition jobAvailable = lock.newCondition();
    private final ArrayDeque<AuditJob> jobs = new ArrayDeque<>();
    private final Map<Long, ProgressEntry> progressByAudit = new HashMap<>();

    public AuditJobQueue(AuditJdbcRepository repository, AuditProperties properties, Clock clock) {
        this.repository = repository;
        this.clock = clock;
        this.progressRetention = properties.getQueue().getProgressRetention();
    }

    public void enqueue(AuditJob job) {
        repository.markAuditStatus(job.auditId(), AuditStatus.PENDING);
        lock.lock();
        try {
            putProgress(job.auditId(), JobProgress.queued());
            jobs.addLast(job);
            jobAvailable.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Next job, or null when the queue is empty.
     */
    public AuditJob dequeue() {
        lock.lock();
        try {
            return jobs.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until a job is available.
     */
    public AuditJob take() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (jobs.isEmpty()) {
                jobAvailable.await();
            }
            return jobs.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return jobs.size();
        } finally {
            lock.unlock();
        }
    }

    public JobProgress progress(long auditId) {
        lock.lock();
        try {
            purgeExpired();
            ProgressEntry entry = progressByAudit.get(auditId);
            return entry == null ? null : entry.progress();
        } finally {
            lock.unlock();
        }
    }

    public void setProgress(long auditId, JobProgress progress) {
        lock.lock();
        try {
            purgeExpired();
            putProgress(auditId, progress);
        } finally {
            lock.unlock();
        }
    }

    private void putProgress(long auditId, JobProgress progress) {
        Instant terminalAt = progress.stage().isTerminal() ? clock.instant() : null;
        progressByAudit.put(auditId, new ProgressEntry(progress, terminalAt));
    }

    private void purgeExpired() {
        Instant cutoff = clock.instant().minus(progressRetention);
        Iterator<ProgressEntry> entries = progressByAudit.values().iterator();
        while (entries.hasNext()) {
            ProgressEntry entry = entries.next();
            if (entry.terminalAt() != null && !entry.terminalAt().isAfter(cutoff)) {
                entries.remove();
            }
        }
    }

    private record ProgressEntry(JobProgress progress, Instant terminalAt) {
    }
}
