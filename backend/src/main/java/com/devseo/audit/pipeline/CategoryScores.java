package com.devseo.audit.pipeline;

public record CategoryScores(int meta, int content, int performance, int technical, int overall) {
}
