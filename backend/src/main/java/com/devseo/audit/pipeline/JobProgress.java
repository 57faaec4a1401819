package com.devseo.audit.pipeline;

public record JobProgress(JobStage stage, String message, int percent) {
    public JobProgress {
        percent = Math.max(0, Math.min(100, percent));
    }

    public static JobProgress queued() {
        return new JobProgress(JobStage.QUEUED, "Waiting in queue", 0);
    }

    public static JobProgress crawling() {
        return new JobProgress(JobStage.CRAWLING, "Crawling website pages", 10);
    }

    public static JobProgress analyzing() {
        return new JobProgress(JobStage.ANALYZING, "Running SEO rule analysis", 40);
    }

    public static JobProgress fixing() {
        return new JobProgress(JobStage.FIXING, "Generating AI-powered fixes", 60);
    }

    public static JobProgress saving() {
        return new JobProgress(JobStage.SAVING, "Saving results", 85);
    }

    public static JobProgress done() {
        return new JobProgress(JobStage.DONE, "Audit complete", 100);
    }

    public static JobProgress error(String message) {
        return new JobProgress(JobStage.ERROR, message == null ? "Audit failed" : message, 0);
    }
}
