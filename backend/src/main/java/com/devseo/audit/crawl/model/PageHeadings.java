package com.devseo.audit.crawl.model;

import java.util.List;

public record PageHeadings(
    List<String> h1,
    List<String> h2,
    List<String> h3,
    List<String> h4,
    List<String> h5,
    List<String> h6
) {
    public PageHeadings {
        h1 = h1 == null ? List.of() : List.copyOf(h1);
        h2 = h2 == null ? List.of() : List.copyOf(h2);
        h3 = h3 == null ? List.of() : List.copyOf(h3);
        h4 = h4 == null ? List.of() : List.copyOf(h4);
        h5 = h5 == null ? List.of() : List.copyOf(h5);
        h6 = h6 == null ? List.of() : List.copyOf(h6);
    }

    public static PageHeadings empty() {
        return new PageHeadings(List.of(), List.of(), List.of(), List.of(), List.of(), List.of());
    }

    public static PageHeadings ofH1(String... h1) {
        return new PageHeadings(List.of(h1), List.of(), List.of(), List.of(), List.of(), List.of());
    }
}
