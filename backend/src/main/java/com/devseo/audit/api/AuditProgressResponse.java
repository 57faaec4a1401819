package com.devseo.audit.api;

import com.devseo.audit.persistence.AuditStatus;
import com.devseo.audit.pipeline.JobProgress;

/**
 * {@code progress} is null once the audit has left the live progress table.
 */
public record AuditProgressResponse(AuditStatus status, JobProgress progress) {
}
