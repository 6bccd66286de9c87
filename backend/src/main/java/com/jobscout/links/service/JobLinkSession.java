package com.jobscout.links.service;

import com.jobscout.links.classify.GeographyFilter;
import com.jobscout.links.classify.PostingClassifier;
import com.jobscout.links.classify.PostingVerdict;
import com.jobscout.links.dedup.DedupMerger;
import com.jobscout.links.dedup.DedupState;
import com.jobscout.links.model.FoundJob;
import com.jobscout.links.model.JobKey;
import com.jobscout.links.model.JobRecord;
import com.jobscout.links.model.LinkDecision;
import com.jobscout.links.model.RawLink;
import com.jobscout.links.model.RejectionReason;
import com.jobscout.links.util.JobKeyExtractor;
import com.jobscout.links.util.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One pass of link triage. Each raw link is normalized, classified, location-checked, keyed
 * and admitted (or rejected) before the next one is considered, so stopping early leaves a
 * consistent state. Not thread-safe; a session belongs to the thread driving the run.
 */
public class JobLinkSession {
    private static final Logger log = LoggerFactory.getLogger(JobLinkSession.class);

    private final PostingClassifier postingClassifier;
    private final GeographyFilter geographyFilter;
    private final DedupMerger dedupMerger;
    private final Clock clock;
    private final DedupState state = new DedupState();
    private final Map<RejectionReason, Integer> rejectionCounts = new EnumMap<>(RejectionReason.class);

    JobLinkSession(
        PostingClassifier postingClassifier,
        GeographyFilter geographyFilter,
        DedupMerger dedupMerger,
        Clock clock
    ) {
        this.postingClassifier = postingClassifier;
        this.geographyFilter = geographyFilter;
        this.dedupMerger = dedupMerger;
        this.clock = clock;
    }

    /**
     * Seeds the session with previously persisted rows. Keys are recomputed from the URLs.
     *
     * @return number of distinct historical keys after loading
     */
    public int loadHistory(Collection<FoundJob> rows) {
        if (rows == null) {
            return state.historicalKeys().size();
        }
        int unkeyable = 0;
        for (FoundJob row : rows) {
            if (row == null || row.url() == null || row.url().isBlank()) {
                continue;
            }
            JobKey key = JobKeyExtractor.extract(row.url()).orElse(null);
            if (key == null) {
                unkeyable++;
            }
            state.addHistorical(new JobRecord(row.url(), row.firstSeen(), key));
        }
        if (unkeyable > 0) {
            log.info("{} historical rows have no descriptive key and will not be carried forward", unkeyable);
        }
        return state.historicalKeys().size();
    }

    public void seedKeys(Iterable<JobKey> keys) {
        if (keys == null) {
            return;
        }
        for (JobKey key : keys) {
            state.seedHistoricalKey(key);
        }
    }

    public LinkDecision classify(RawLink link) {
        LinkDecision decision = decide(link);
        if (!decision.isAccepted()) {
            rejectionCounts.merge(decision.reason(), 1, Integer::sum);
            if (log.isDebugEnabled()) {
                log.debug("Rejected {} ({})", decision.url(), decision.reason().code());
            }
        }
        return decision;
    }

    private LinkDecision decide(RawLink link) {
        String href = link == null ? null : link.href();
        if (!UrlNormalizer.isNavigable(href)) {
            return LinkDecision.rejected(href, RejectionReason.NOT_NAVIGABLE);
        }
        String url = UrlNormalizer.normalize(href, link.sourcePageUrl());
        if (url == null) {
            return LinkDecision.rejected(href, RejectionReason.MALFORMED_URL);
        }

        PostingVerdict verdict = postingClassifier.evaluate(url, link.sourcePageUrl());
        if (verdict == PostingVerdict.REJECT_SELF_LINK) {
            return LinkDecision.rejected(url, RejectionReason.SELF_LINK);
        }
        if (verdict != PostingVerdict.ACCEPT) {
            return LinkDecision.rejected(url, RejectionReason.NOT_POSTING_SHAPED);
        }

        if (geographyFilter.isDisallowed(url, link.anchorText())) {
            return LinkDecision.rejected(url, RejectionReason.DISALLOWED_LOCATION);
        }

        JobKey key = JobKeyExtractor.extract(url).orElse(null);
        if (key == null) {
            log.debug("Could not derive a descriptive key for posting {}", url);
        }
        LocalDateTime now = LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
        return dedupMerger.admit(state, url, key, now);
    }

    public List<FoundJob> finalizeRecords() {
        return dedupMerger.reconcile(state);
    }

    public List<JobRecord> acceptedRecords() {
        return state.acceptedRecords();
    }

    public Map<String, Integer> rejectionCounts() {
        Map<String, Integer> out = new LinkedHashMap<>();
        for (Map.Entry<RejectionReason, Integer> entry : rejectionCounts.entrySet()) {
            out.put(entry.getKey().code(), entry.getValue());
        }
        return out;
    }
}
