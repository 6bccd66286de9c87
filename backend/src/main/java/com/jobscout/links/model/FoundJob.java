package com.jobscout.links.model;

import java.time.LocalDateTime;

/**
 * Externally visible row of the found-jobs list. {@code firstSeen} is null when a persisted
 * row carried a date that could not be read back.
 */
public record FoundJob(
    String url,
    LocalDateTime firstSeen
) {
}
