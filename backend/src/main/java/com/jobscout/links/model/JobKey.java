package com.jobscout.links.model;

/**
 * Deduplication identity of a posting: lowercased host plus the path suffix starting at the
 * right-most marker segment. Rendered as {@code host::path}.
 */
public record JobKey(String domain, String descriptivePath) {
    public static final String SEPARATOR = "::";

    public String value() {
        return domain + SEPARATOR + descriptivePath;
    }

    @Override
    public String toString() {
        return value();
    }
}
