package com.jobscout.links.service;

import java.time.Instant;

public class ActiveScrapeRunException extends RuntimeException {
    private final Instant activeSince;

    public ActiveScrapeRunException(Instant activeSince) {
        super("A scrape run is already in progress since " + activeSince);
        this.activeSince = activeSince;
    }

    public Instant getActiveSince() {
        return activeSince;
    }
}
