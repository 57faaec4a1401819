package com.devseo.audit.pipeline;

import com.devseo.audit.crawl.util.CrawlUrlUtils;
import com.devseo.audit.persistence.AuditJdbcRepository;
import com.devseo.audit.persistence.AuditRecord;
import com.devseo.audit.persistence.CreditTransactionType;
import com.devseo.audit.persistence.UserProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.net.URI;
import java.util.Locale;

/**
 * Accepts audit requests: charges one credit, records the audit and hands it to the queue.
 */
@Service
public class AuditSubmissionService {
    private static final Logger log = LoggerFactory.getLogger(AuditSubmissionService.class);
    private static final int AUDIT_COST = 1;

    private final AuditJdbcRepository repository;
    private final AuditJobQueue queue;
    private final TransactionTemplate transactionTemplate;

    public AuditSubmissionService(
        AuditJdbcRepository repository,
        AuditJobQueue queue,
        TransactionTemplate transactionTemplate
    ) {
        this.repository = repository;
        this.queue = queue;
        this.transactionTemplate = transactionTemplate;
    }

    public AuditRecord submit(String userId, String url) {
        UserProfile profile = repository.ensureProfile(userId);
        if (profile.credits() < AUDIT_COST) {
            throw insufficientCredits();
        }
        URI parsed = CrawlUrlUtils.parseHttpUrl(url);
        if (parsed == null) {
            throw new InvalidAuditUrlException("Invalid URL provided");
        }
        String normalizedUrl = url.trim();
        String domain = parsed.getHost().toLowerCase(Locale.ROOT);

        // The balance may have moved since the check above; the debit itself is the authority.
        Long auditId = transactionTemplate.execute(status -> {
            if (!repository.adjustProfileCredits(userId, -AUDIT_COST)) {
                throw insufficientCredits();
            }
            long id = repository.createAudit(userId, normalizedUrl, domain);
            repository.insertCreditTransaction(
                userId,
                -AUDIT_COST,
                CreditTransactionType.DEBIT,
                "SEO audit: " + normalizedUrl,
                id
            );
            return id;
        });
        long id = auditId == null ? 0L : auditId;
        AuditRecord created = repository.findAudit(id);
        queue.enqueue(new AuditJob(id, userId, normalizedUrl, domain));
        log.info("Queued audit #{} for {} user={} queueSize={}", id, normalizedUrl, userId, queue.size());
        return created;
    }

    private static InsufficientCreditsException insufficientCredits() {
        return new InsufficientCreditsException("Not enough credits. Please upgrade your plan.");
    }

    /**
     * Returns the audit when it exists and belongs to {@code userId}.
     */
    public AuditRecord requireOwnedAudit(String userId, long auditId) {
        AuditRecord audit = repository.findAudit(auditId);
        if (audit == null || !audit.userId().equals(userId)) {
            throw new AuditNotFoundException(auditId);
        }
        return audit;
    }
}
