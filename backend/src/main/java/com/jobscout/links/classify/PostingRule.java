package com.jobscout.links.classify;

import java.util.function.Predicate;

public record PostingRule(
    String name,
    Predicate<PostingCandidate> condition,
    PostingVerdict verdict
) {
    public boolean appliesTo(PostingCandidate candidate) {
        return condition.test(candidate);
    }
}
