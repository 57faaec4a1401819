package com.devseo.audit.analysis;

public record AnalysisMeta(int pagesAnalyzed, int totalIssues, int critical, int warnings, int info) {
}
