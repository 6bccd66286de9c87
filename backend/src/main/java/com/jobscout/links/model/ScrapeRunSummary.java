package com.jobscout.links.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record ScrapeRunSummary(
    Instant startedAt,
    Instant finishedAt,
    int pagesProcessed,
    int pagesFailed,
    int historicalKeysLoaded,
    Map<String, Integer> rejectionCounts,
    List<PageScrapeSummary> pages,
    List<FoundJob> newJobs,
    int totalJobs,
    boolean saved
) {
}
