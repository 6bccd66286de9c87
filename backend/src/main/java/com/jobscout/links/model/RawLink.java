package com.jobscout.links.model;

public record RawLink(
    String href,
    String anchorText,
    String sourcePageUrl
) {
}
