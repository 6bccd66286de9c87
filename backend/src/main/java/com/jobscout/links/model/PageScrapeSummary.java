package com.jobscout.links.model;

import java.util.List;

public record PageScrapeSummary(
    String sourcePageUrl,
    int linksProcessed,
    int newJobsFound,
    List<String> newJobUrls,
    String errorCode,
    String errorMessage
) {
}
