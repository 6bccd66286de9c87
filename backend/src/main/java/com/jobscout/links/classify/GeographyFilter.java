package com.jobscout.links.classify;

import com.jobscout.config.ScoutProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Rejects postings whose URL or anchor text points at a location outside the target regions.
 *
 * <p>Evaluation is two-phase: the allowed vocabulary is scanned to completion first and any hit
 * keeps the link, even when a disallowed keyword is also present. Only when no allowed keyword
 * matched is the disallowed vocabulary consulted. No evidence either way keeps the link.
 */
@Component
public class GeographyFilter {
    private static final Pattern LIST_SEPARATORS = Pattern.compile("[,()/]");

    private final List<KeywordMatcher> allowed;
    private final List<KeywordMatcher> disallowedWords;
    private final List<String> disallowedPathSegments;

    @Autowired
    public GeographyFilter(ScoutProperties properties) {
        this(properties.getLocation().getAllowed(), properties.getLocation().getDisallowed());
    }

    public GeographyFilter(List<String> allowedKeywords, List<String> disallowedKeywords) {
        this.allowed = new ArrayList<>();
        for (String keyword : LocationKeywords.clean(allowedKeywords)) {
            allowed.add(KeywordMatcher.of(keyword));
        }
        this.disallowedWords = new ArrayList<>();
        this.disallowedPathSegments = new ArrayList<>();
        for (String keyword : LocationKeywords.clean(disallowedKeywords)) {
            if (LocationKeywords.isPathSegment(keyword)) {
                disallowedPathSegments.add(keyword);
            } else {
                disallowedWords.add(KeywordMatcher.of(keyword));
            }
        }
    }

    public boolean isDisallowed(String normalizedUrl, String anchorText) {
        String corpus = buildCorpus(normalizedUrl, anchorText);
        if (findAllowed(corpus).isPresent()) {
            return false;
        }
        return findDisallowed(normalizedUrl, corpus).isPresent();
    }

    public Optional<String> findAllowed(String corpus) {
        for (KeywordMatcher matcher : allowed) {
            if (matcher.matches(corpus)) {
                return Optional.of(matcher.keyword());
            }
        }
        return Optional.empty();
    }

    public Optional<String> findDisallowed(String normalizedUrl, String corpus) {
        String lowerUrl = normalizedUrl == null ? "" : normalizedUrl.toLowerCase(Locale.ROOT);
        for (String segment : disallowedPathSegments) {
            if (lowerUrl.contains(segment)) {
                return Optional.of(segment);
            }
        }
        for (KeywordMatcher matcher : disallowedWords) {
            if (matcher.matches(corpus)) {
                return Optional.of(matcher.keyword());
            }
        }
        return Optional.empty();
    }

    public static String buildCorpus(String normalizedUrl, String anchorText) {
        String corpus = normalizedUrl == null ? "" : normalizedUrl.toLowerCase(Locale.ROOT);
        if (anchorText != null && !anchorText.isEmpty()) {
            String cleaned = LIST_SEPARATORS.matcher(anchorText.toLowerCase(Locale.ROOT)).replaceAll(" ");
            corpus = corpus + " " + cleaned;
        }
        return corpus;
    }

    /**
     * Keyword bounded by non-word characters or the ends of the corpus, so {@code sf} does not
     * match inside {@code staff}.
     */
    record KeywordMatcher(String keyword, Pattern pattern) {
        static KeywordMatcher of(String keyword) {
            Pattern pattern = Pattern.compile(
                "(?:\\W|^)" + Pattern.quote(keyword) + "(?:\\W|$)",
                Pattern.UNICODE_CHARACTER_CLASS
            );
            return new KeywordMatcher(keyword, pattern);
        }

        boolean matches(String corpus) {
            return pattern.matcher(corpus).find();
        }
    }
}
