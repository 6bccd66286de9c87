package com.jobscout.links.model;

/**
 * Outcome of triaging one raw link: either an accepted record or a rejection reason, never both.
 */
public record LinkDecision(
    String url,
    JobRecord record,
    RejectionReason reason
) {
    public static LinkDecision accepted(JobRecord record) {
        return new LinkDecision(record.url(), record, null);
    }

    public static LinkDecision rejected(String url, RejectionReason reason) {
        return new LinkDecision(url, null, reason);
    }

    public boolean isAccepted() {
        return record != null;
    }
}
