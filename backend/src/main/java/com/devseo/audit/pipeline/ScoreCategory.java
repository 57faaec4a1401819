package com.devseo.audit.pipeline;

enum ScoreCategory {
    META,
    CONTENT,
    PERFORMANCE,
    TECHNICAL
}
