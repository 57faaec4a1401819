package com.devseo.audit.fix;

import com.fasterxml.jackson.databind.node.ObjectNode;

public record AiFix(
    String pageUrl,
    String optimizedTitle,
    String optimizedMetaDescription,
    String improvedH1,
    ObjectNode jsonLdSchema,
    String suggestedInternalLinkingText
) {
}
