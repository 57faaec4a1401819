package com.devseo.audit.fix;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Fields decoded from a completion response; any of them may be null when absent or of the wrong type.
 */
record FixCandidate(
    String optimizedTitle,
    String optimizedMetaDescription,
    String improvedH1,
    ObjectNode jsonLdSchema,
    String suggestedInternalLinkingText
) {
    static FixCandidate empty() {
        return new FixCandidate(null, null, null, null, null);
    }

    AiFix completeWith(AiFix fallback) {
        return new AiFix(
            fallback.pageUrl(),
            optimizedTitle != null ? optimizedTitle : fallback.optimizedTitle(),
            optimizedMetaDescription != null ? optimizedMetaDescription : fallback.optimizedMetaDescription(),
            improvedH1 != null ? improvedH1 : fallback.improvedH1(),
            jsonLdSchema != null ? jsonLdSchema : fallback.jsonLdSchema(),
            suggestedInternalLinkingText != null ? suggestedInternalLinkingText : fallback.suggestedInternalLinkingText()
        );
    }
}
