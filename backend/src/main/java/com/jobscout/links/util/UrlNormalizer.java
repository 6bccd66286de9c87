package com.jobscout.links.util;

import java.net.MalformedURLException;
import java.net.URL;
import java.util.List;
import java.util.Locale;

/**
 * Canonicalizes anchor hrefs harvested from a career page into absolute, query-free URLs.
 */
public final class UrlNormalizer {
    private static final List<String> NON_NAVIGABLE_PREFIXES = List.of(
        "#",
        "mailto:",
        "tel:",
        "javascript:"
    );

    private UrlNormalizer() {
    }

    public static boolean isNavigable(String href) {
        if (href == null || href.isEmpty()) {
            return false;
        }
        String lower = href.toLowerCase(Locale.ROOT);
        for (String prefix : NON_NAVIGABLE_PREFIXES) {
            if (lower.startsWith(prefix)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Resolves {@code href} against the page it was found on, drops everything from the first
     * {@code ?} or {@code #} and a single trailing {@code /}.
     *
     * @return the normalized URL, or null when the href is not navigable or cannot be resolved
     */
    public static String normalize(String href, String sourcePageUrl) {
        if (!isNavigable(href) || sourcePageUrl == null || sourcePageUrl.isBlank()) {
            return null;
        }
        String absolute;
        try {
            absolute = dropSegmentsAboveRoot(new URL(new URL(sourcePageUrl.trim()), href.trim()));
        } catch (MalformedURLException | IllegalArgumentException e) {
            return null;
        }
        String stripped = stripQueryAndFragment(absolute);
        if (stripped.endsWith("/")) {
            stripped = stripped.substring(0, stripped.length() - 1);
        }
        return stripped.isEmpty() ? null : stripped;
    }

    /**
     * {@code ..} segments that would climb above the root are dropped, so
     * {@code ../../job/1} from {@code /careers/list} resolves to {@code /job/1}.
     */
    static String dropSegmentsAboveRoot(URL url) {
        String text = url.toString();
        String authority = url.getAuthority();
        if (authority == null) {
            return text;
        }
        String prefix = url.getProtocol() + "://" + authority;
        if (!text.startsWith(prefix)) {
            return text;
        }
        String rest = text.substring(prefix.length());
        while (true) {
            if (rest.startsWith("/../")) {
                rest = rest.substring(3);
            } else if (rest.equals("/..") || rest.startsWith("/..?") || rest.startsWith("/..#")) {
                rest = "/" + rest.substring(3);
            } else {
                break;
            }
        }
        return prefix + rest;
    }

    public static String stripQueryAndFragment(String url) {
        int cut = url.length();
        int queryIdx = url.indexOf('?');
        if (queryIdx >= 0) {
            cut = queryIdx;
        }
        int hashIdx = url.indexOf('#');
        if (hashIdx >= 0 && hashIdx < cut) {
            cut = hashIdx;
        }
        return url.substring(0, cut);
    }

    public static String trimTrailingSlash(String url) {
        if (url == null) {
            return null;
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
