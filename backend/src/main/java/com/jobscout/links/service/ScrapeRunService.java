package com.jobscout.links.service;

import com.jobscout.links.history.FoundJobsCsvStore;
import com.jobscout.links.history.TargetSiteReader;
import com.jobscout.links.model.FoundJob;
import com.jobscout.links.model.JobRecord;
import com.jobscout.links.model.LinkDecision;
import com.jobscout.links.model.PageLinks;
import com.jobscout.links.model.PageScrapeSummary;
import com.jobscout.links.model.RawLink;
import com.jobscout.links.model.ScrapeRunSummary;
import com.jobscout.links.pages.CareerPageFetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives one scrape run: load history, visit each target page in order, triage its links and
 * persist the reconciled list. A failing page is reported and skipped; it never discards what
 * other pages already contributed.
 */
@Service
public class ScrapeRunService {
    private static final Logger log = LoggerFactory.getLogger(ScrapeRunService.class);

    private final LinkTriageService linkTriageService;
    private final CareerPageFetcher careerPageFetcher;
    private final FoundJobsCsvStore foundJobsStore;
    private final TargetSiteReader targetSiteReader;
    private final Clock clock;
    private final AtomicReference<Instant> activeSince = new AtomicReference<>();
    private final AtomicReference<ScrapeRunSummary> latestSummary = new AtomicReference<>();

    public ScrapeRunService(
        LinkTriageService linkTriageService,
        CareerPageFetcher careerPageFetcher,
        FoundJobsCsvStore foundJobsStore,
        TargetSiteReader targetSiteReader,
        Clock clock
    ) {
        this.linkTriageService = linkTriageService;
        this.careerPageFetcher = careerPageFetcher;
        this.foundJobsStore = foundJobsStore;
        this.targetSiteReader = targetSiteReader;
        this.clock = clock;
    }

    /**
     * @param requestedTargets explicit target pages, or null/empty to read the configured list
     */
    public ScrapeRunSummary run(List<String> requestedTargets) {
        Instant startedAt = clock.instant();
        if (!activeSince.compareAndSet(null, startedAt)) {
            throw new ActiveScrapeRunException(activeSince.get());
        }
        try {
            List<String> targets = requestedTargets == null || requestedTargets.isEmpty()
                ? targetSiteReader.read()
                : TargetSiteReader.sanitize(requestedTargets);
            ScrapeRunSummary summary = execute(startedAt, targets);
            latestSummary.set(summary);
            return summary;
        } finally {
            activeSince.set(null);
        }
    }

    public Optional<ScrapeRunSummary> latestSummary() {
        return Optional.ofNullable(latestSummary.get());
    }

    public List<FoundJob> currentJobs() throws IOException {
        return foundJobsStore.load();
    }

    /**
     * Triages the given links against the persisted history without saving anything.
     */
    public List<LinkDecision> dryRun(List<RawLink> links) {
        JobLinkSession session = linkTriageService.openSession();
        session.loadHistory(loadHistory().rows());
        List<LinkDecision> decisions = new ArrayList<>();
        if (links == null) {
            return decisions;
        }
        for (RawLink link : links) {
            decisions.add(session.classify(link));
        }
        return decisions;
    }

    private ScrapeRunSummary execute(Instant startedAt, List<String> targets) {
        log.info("Starting scrape run over {} target pages", targets.size());
        JobLinkSession session = linkTriageService.openSession();
        HistoryLoad history = loadHistory();
        int historicalKeys = session.loadHistory(history.rows());
        log.info("Loaded {} unique descriptive keys from history", historicalKeys);

        List<PageScrapeSummary> pages = new ArrayList<>();
        int pagesFailed = 0;
        for (String target : targets) {
            PageScrapeSummary page = processPage(session, target);
            if (page.errorCode() != null) {
                pagesFailed++;
            }
            pages.add(page);
        }

        List<FoundJob> newJobs = new ArrayList<>();
        for (JobRecord record : session.acceptedRecords()) {
            newJobs.add(record.toFoundJob());
        }
        List<FoundJob> finalRows = session.finalizeRecords();
        boolean saved = false;
        if (newJobs.isEmpty()) {
            log.info("No new job postings found in this run (or all were filtered by location/duplicates)");
        } else if (history.failed()) {
            // the unreadable file is left as is rather than replaced by this run's rows alone
            log.error("History at {} could not be read; not overwriting it", foundJobsStore.path());
            logUnsaved(newJobs);
        } else {
            saved = save(finalRows, newJobs);
        }

        ScrapeRunSummary summary = new ScrapeRunSummary(
            startedAt,
            clock.instant(),
            targets.size(),
            pagesFailed,
            historicalKeys,
            session.rejectionCounts(),
            pages,
            newJobs,
            finalRows.size(),
            saved
        );
        log.info(
            "Scrape run finished: pages={}, failed={}, newJobs={}, totalJobs={}, rejections={}",
            summary.pagesProcessed(),
            summary.pagesFailed(),
            newJobs.size(),
            summary.totalJobs(),
            summary.rejectionCounts()
        );
        return summary;
    }

    private PageScrapeSummary processPage(JobLinkSession session, String target) {
        log.info("Processing {}", target);
        int processed = 0;
        List<String> accepted = new ArrayList<>();
        try {
            PageLinks page = careerPageFetcher.fetch(target);
            if (!page.isSuccessful()) {
                log.warn("Error processing {}: {} ({})", target, page.errorCode(), page.errorMessage());
                return new PageScrapeSummary(target, 0, 0, List.of(), page.errorCode(), page.errorMessage());
            }
            for (RawLink link : page.links()) {
                processed++;
                LinkDecision decision = session.classify(link);
                if (decision.isAccepted()) {
                    accepted.add(decision.url());
                    log.info("  - {} (Key: {})", decision.url(), decision.record().key());
                }
            }
        } catch (RuntimeException e) {
            log.warn("Error processing {}", target, e);
            return new PageScrapeSummary(target, processed, accepted.size(), accepted, "exception", e.getMessage());
        }
        log.info("Processed {} links on {}, identified {} new jobs in allowed locations", processed, target, accepted.size());
        return new PageScrapeSummary(target, processed, accepted.size(), accepted, null, null);
    }

    private HistoryLoad loadHistory() {
        try {
            return new HistoryLoad(foundJobsStore.load(), false);
        } catch (IOException e) {
            log.error("Could not load history from {}, proceeding without existing keys", foundJobsStore.path(), e);
            return new HistoryLoad(List.of(), true);
        }
    }

    private boolean save(List<FoundJob> finalRows, List<FoundJob> newJobs) {
        try {
            foundJobsStore.save(finalRows);
            log.info("Saved {} unique links to {}", finalRows.size(), foundJobsStore.path());
            return true;
        } catch (IOException e) {
            log.error("Could not save results to {}", foundJobsStore.path(), e);
            logUnsaved(newJobs);
            return false;
        }
    }

    private void logUnsaved(List<FoundJob> newJobs) {
        for (FoundJob job : newJobs) {
            log.error("Unsaved new link: {}", job.url());
        }
    }

    private record HistoryLoad(List<FoundJob> rows, boolean failed) {
    }
}
