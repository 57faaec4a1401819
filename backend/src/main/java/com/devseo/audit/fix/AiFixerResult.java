package com.devseo.audit.fix;

import java.util.List;

public record AiFixerResult(List<AiFix> fixes, int totalFixesGenerated) {
    public AiFixerResult {
        fixes = fixes == null ? List.of() : List.copyOf(fixes);
    }

    public static AiFixerResult of(List<AiFix> fixes) {
        return new AiFixerResult(fixes, fixes == null ? 0 : fixes.size());
    }
}
