package com.jobscout.links.classify;

import java.util.Locale;
import java.util.Set;

/**
 * Posting-detail URL shapes of hosted recruiting platforms that are known to be free of false
 * positives. Each vendor lists the generic negative substrings its own detail paths contain.
 */
public enum VendorPattern {
    WORKDAY_JOB("myworkdayjobs.com", "/job/", Set.of("/jobs", "/careers")),
    TALEO_OPPORTUNITY(".tal.net", "/opp/", Set.of("/jobs", "/careers", "/candidate"));

    private final String hostToken;
    private final String pathToken;
    private final Set<String> allowedNegatives;

    VendorPattern(String hostToken, String pathToken, Set<String> allowedNegatives) {
        this.hostToken = hostToken;
        this.pathToken = pathToken;
        this.allowedNegatives = allowedNegatives;
    }

    public boolean matches(String url) {
        if (url == null) {
            return false;
        }
        String lower = url.toLowerCase(Locale.ROOT);
        return lower.contains(hostToken) && lower.contains(pathToken);
    }

    public boolean allowsNegative(String negativeKeyword) {
        return allowedNegatives.contains(negativeKeyword);
    }
}
