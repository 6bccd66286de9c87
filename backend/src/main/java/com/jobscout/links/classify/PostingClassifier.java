package com.jobscout.links.classify;

import com.jobscout.links.util.UrlNormalizer;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Decides whether a normalized URL looks like a single job posting rather than a listing,
 * navigation, social or login page.
 *
 * <p>Rules are evaluated in order and the first one that applies decides. High-confidence
 * vendor shapes win over the generic deny-list; anything no rule accepts is rejected.
 */
@Component
public class PostingClassifier {
    static final List<String> NEGATIVE_KEYWORDS = List.of(
        "/careers",
        "/jobs",
        "/jobboard",
        "/search",
        "/opportunities",
        "candidate/jobboard",
        "login",
        "signin",
        "register",
        "event",
        "about",
        "contact",
        "privacy",
        "terms",
        ".pdf",
        ".jpg",
        ".png",
        "facebook.com",
        "linkedin.com",
        "twitter.com",
        "instagram.com",
        "googleusercontent.com"
    );

    static final String ADVISORY_SEGMENT = "/adv";
    static final int ADVISORY_MAX_EXTRA_DEPTH = 3;

    private static final Pattern IDENTIFIER_TOKEN = Pattern.compile(
        "jobid=|job_id=|requisitionid=|postingid=",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern NUMERIC_SEGMENT = Pattern.compile("/\\d{5,}(?=/|$)");

    private final List<PostingRule> rules = List.of(
        new PostingRule("self-link", PostingClassifier::isSelfLink, PostingVerdict.REJECT_SELF_LINK),
        new PostingRule("advisory-page", PostingClassifier::isShallowAdvisoryPage, PostingVerdict.REJECT),
        new PostingRule("negative-signal", PostingClassifier::hasUnexcusedNegativeSignal, PostingVerdict.REJECT),
        new PostingRule("vendor-detail", PostingCandidate::isVendorPosting, PostingVerdict.ACCEPT),
        new PostingRule("posting-identifier", PostingClassifier::hasPostingIdentifier, PostingVerdict.ACCEPT)
    );

    public List<PostingRule> rules() {
        return rules;
    }

    public boolean isPosting(String normalizedUrl, String sourcePageUrl) {
        return evaluate(normalizedUrl, sourcePageUrl) == PostingVerdict.ACCEPT;
    }

    public PostingVerdict evaluate(String normalizedUrl, String sourcePageUrl) {
        if (normalizedUrl == null || normalizedUrl.isBlank()) {
            return PostingVerdict.REJECT;
        }
        PostingCandidate candidate = PostingCandidate.of(normalizedUrl, sourcePageUrl);
        for (PostingRule rule : rules) {
            if (rule.appliesTo(candidate)) {
                return rule.verdict();
            }
        }
        return PostingVerdict.REJECT;
    }

    static boolean isSelfLink(PostingCandidate candidate) {
        if (candidate.lowerSourcePageUrl().isEmpty()) {
            return false;
        }
        return UrlNormalizer.trimTrailingSlash(candidate.lowerUrl())
            .equals(UrlNormalizer.trimTrailingSlash(candidate.lowerSourcePageUrl()));
    }

    static boolean isShallowAdvisoryPage(PostingCandidate candidate) {
        String lower = candidate.lowerUrl();
        if (!lower.endsWith(ADVISORY_SEGMENT) && !lower.endsWith(ADVISORY_SEGMENT + "/")) {
            return false;
        }
        int depth = candidate.url().split("/", -1).length;
        int sourceDepth = candidate.sourcePageUrl().split("/", -1).length;
        return depth < sourceDepth + ADVISORY_MAX_EXTRA_DEPTH;
    }

    static boolean hasUnexcusedNegativeSignal(PostingCandidate candidate) {
        for (String keyword : NEGATIVE_KEYWORDS) {
            if (candidate.lowerUrl().contains(keyword) && !candidate.vendorAllowsNegative(keyword)) {
                return true;
            }
        }
        return false;
    }

    static boolean hasPostingIdentifier(PostingCandidate candidate) {
        return IDENTIFIER_TOKEN.matcher(candidate.url()).find()
            || NUMERIC_SEGMENT.matcher(candidate.url()).find();
    }
}
