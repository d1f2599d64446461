package com.phillippitts.podcaster.domain;

import java.util.Objects;

/**
 * Where the podcast content comes from.
 *
 * @param kind   source kind
 * @param detail kind-specific locator, e.g. the page URL
 */
public record SourceReference(SourceKind kind, String detail) {

    public SourceReference {
        Objects.requireNonNull(kind, "Source kind must not be null");
        if (detail == null || detail.isBlank()) {
            throw new IllegalArgumentException("Source detail must not be blank");
        }
    }

    public static SourceReference url(String url) {
        return new SourceReference(SourceKind.URL, url);
    }
}
