package com.jobscout.links.model;

import java.time.LocalDateTime;

public record JobRecord(
    String url,
    LocalDateTime firstSeen,
    JobKey key
) {
    public FoundJob toFoundJob() {
        return new FoundJob(url, firstSeen);
    }
}
