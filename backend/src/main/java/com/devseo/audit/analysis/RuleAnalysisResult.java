package com.devseo.audit.analysis;

import java.util.List;

public record RuleAnalysisResult(List<SeoIssue> issues, AnalysisMeta meta) {
    public RuleAnalysisResult {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }
}
