package com.jobscout.links.service;

import com.jobscout.links.classify.GeographyFilter;
import com.jobscout.links.classify.PostingClassifier;
import com.jobscout.links.dedup.DedupMerger;
import org.springframework.stereotype.Service;

import java.time.Clock;

@Service
public class LinkTriageService {
    private final PostingClassifier postingClassifier;
    private final GeographyFilter geographyFilter;
    private final DedupMerger dedupMerger;
    private final Clock clock;

    public LinkTriageService(
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

    public JobLinkSession openSession() {
        return new JobLinkSession(postingClassifier, geographyFilter, dedupMerger, clock);
    }
}
