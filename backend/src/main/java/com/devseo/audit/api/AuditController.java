package com.devseo.audit.api;

import com.devseo.audit.persistence.AuditJdbcRepository;
import com.devseo.audit.persistence.AuditPageRecord;
import com.devseo.audit.persistence.AuditRecord;
import com.devseo.audit.persistence.CreditTransaction;
import com.devseo.audit.pipeline.AuditJobQueue;
import com.devseo.audit.pipeline.AuditSubmissionService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
public class AuditController {
    static final String USER_HEADER = "X-User-Id";

    private final AuditSubmissionService submissionService;
    private final AuditJdbcRepository repository;
    private final AuditJobQueue queue;

    public AuditController(
        AuditSubmissionService submissionService,
        AuditJdbcRepository repository,
        AuditJobQueue queue
    ) {
        this.submissionService = submissionService;
        this.repository = repository;
        this.queue = queue;
    }

    @PostMapping("/audits")
    @ResponseStatus(HttpStatus.CREATED)
    public AuditRecord createAudit(
        @RequestHeader(USER_HEADER) String userId,
        @RequestBody CreateAuditRequest request
    ) {
        return submissionService.submit(userId, request == null ? null : request.url());
    }

    @GetMapping("/audits")
    public List<AuditRecord> listAudits(@RequestHeader(USER_HEADER) String userId) {
        return repository.findAuditsByUser(userId);
    }

    @GetMapping("/audits/{id}")
    public AuditRecord getAudit(@RequestHeader(USER_HEADER) String userId, @PathVariable("id") long id) {
        return submissionService.requireOwnedAudit(userId, id);
    }

    @GetMapping("/audits/{id}/pages")
    public List<AuditPageRecord> getAuditPages(
        @RequestHeader(USER_HEADER) String userId,
        @PathVariable("id") long id
    ) {
        submissionService.requireOwnedAudit(userId, id);
        return repository.findAuditPages(id);
    }

    @GetMapping("/audits/{id}/progress")
    public AuditProgressResponse getProgress(
        @RequestHeader(USER_HEADER) String userId,
        @PathVariable("id") long id
    ) {
        AuditRecord audit = submissionService.requireOwnedAudit(userId, id);
        return new AuditProgressResponse(audit.status(), queue.progress(id));
    }

    @GetMapping("/credits/history")
    public List<CreditTransaction> creditHistory(@RequestHeader(USER_HEADER) String userId) {
        return repository.findCreditTransactions(userId);
    }
}
