package com.jobscout.links.util;

import com.jobscout.links.model.JobKey;

import java.net.MalformedURLException;
import java.net.URL;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Derives the deduplication key of a posting URL from its host and the path suffix starting at
 * the right-most marker segment. URLs without a marker are unkeyable and yield an empty result.
 */
public final class JobKeyExtractor {
    static final List<String> MARKERS = List.of("/opp/", "/job/");

    private JobKeyExtractor() {
    }

    public static Optional<JobKey> extract(String normalizedUrl) {
        if (normalizedUrl == null || normalizedUrl.isBlank()) {
            return Optional.empty();
        }
        URL url;
        try {
            url = new URL(normalizedUrl.trim());
        } catch (MalformedURLException e) {
            return Optional.empty();
        }
        String host = url.getHost();
        if (host == null || host.isBlank()) {
            return Optional.empty();
        }
        String domain = host.toLowerCase(Locale.ROOT);
        if (url.getPort() != -1) {
            domain = domain + ":" + url.getPort();
        }

        String path = stripLastSegmentParams(url.getPath() == null ? "" : url.getPath());
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        String lowerPath = path.toLowerCase(Locale.ROOT);

        // deeper markers sit closer to the posting identifier, so the right-most one wins
        String foundMarker = null;
        int markerIndex = -1;
        for (String marker : MARKERS) {
            int idx = lowerPath.lastIndexOf(marker);
            if (idx > markerIndex) {
                markerIndex = idx;
                foundMarker = marker;
            }
        }
        if (foundMarker == null) {
            return Optional.empty();
        }
        String descriptivePath = foundMarker + path.substring(markerIndex + foundMarker.length());
        return Optional.of(new JobKey(domain, descriptivePath));
    }

    /**
     * Drops {@code ;params} from the last path segment, such as a {@code jsessionid}.
     */
    static String stripLastSegmentParams(String path) {
        int semicolon = path.indexOf(';', path.lastIndexOf('/') + 1);
        return semicolon < 0 ? path : path.substring(0, semicolon);
    }
}
