package com.jobscout.links.service;

import com.jobscout.links.classify.GeographyFilter;
import com.jobscout.links.classify.LocationKeywords;
import com.jobscout.links.classify.PostingClassifier;
import com.jobscout.links.dedup.DedupMerger;
import com.jobscout.links.model.FoundJob;
import com.jobscout.links.model.JobKey;
import com.jobscout.links.model.LinkDecision;
import com.jobscout.links.model.RawLink;
import com.jobscout.links.model.RejectionReason;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JobLinkSessionTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:15:30.250Z"), ZoneOffset.UTC);
    private static final LocalDateTime NOW = LocalDateTime.parse("2026-03-01T10:15:30");
    private static final String CAREERS = "https://example.com/careers";

    private LinkTriageService triageService;

    @BeforeEach
    void setUp() {
        triageService = new LinkTriageService(
            new PostingClassifier(),
            new GeographyFilter(LocationKeywords.DEFAULT_ALLOWED, LocationKeywords.DEFAULT_DISALLOWED),
            new DedupMerger(),
            CLOCK
        );
    }

    @Test
    void relativeNumericPostingIsAccepted() {
        JobLinkSession session = triageService.openSession();

        LinkDecision decision = session.classify(new RawLink("/job/12345?src=x", "Analyst", "https://acme.tal.net/careers"));

        assertThat(decision.isAccepted()).isTrue();
        assertThat(decision.url()).isEqualTo("https://acme.tal.net/job/12345");
        assertThat(decision.record().firstSeen()).isEqualTo(NOW);
        assertThat(decision.record().key().value()).isEqualTo("acme.tal.net::/job/12345");
    }

    @Test
    void eachStageReportsItsOwnReason() {
        JobLinkSession session = triageService.openSession();

        assertThat(session.classify(new RawLink("mailto:hr@example.com", "Mail", CAREERS)).reason())
            .isEqualTo(RejectionReason.NOT_NAVIGABLE);
        assertThat(session.classify(new RawLink("foo://bar/job/12345", "Odd", CAREERS)).reason())
            .isEqualTo(RejectionReason.MALFORMED_URL);
        assertThat(session.classify(new RawLink("/careers/", "Careers", CAREERS)).reason())
            .isEqualTo(RejectionReason.SELF_LINK);
        assertThat(session.classify(new RawLink("/about", "About us", CAREERS)).reason())
            .isEqualTo(RejectionReason.NOT_POSTING_SHAPED);
        assertThat(session.classify(new RawLink("/job/12345", "London, UK", CAREERS)).reason())
            .isEqualTo(RejectionReason.DISALLOWED_LOCATION);
        assertThat(session.classify(new RawLink("/positions/12345", "Analyst", CAREERS)).reason())
            .isEqualTo(RejectionReason.NO_KEY);

        assertThat(session.rejectionCounts()).containsEntry("not-navigable", 1)
            .containsEntry("disallowed-location", 1)
            .containsEntry("no-key", 1);
        assertThat(session.acceptedRecords()).isEmpty();
    }

    @Test
    void mixedLocationAnchorIsKept() {
        JobLinkSession session = triageService.openSession();

        LinkDecision decision = session.classify(new RawLink("/job/24680", "New York, NY / London", CAREERS));

        assertThat(decision.isAccepted()).isTrue();
    }

    @Test
    void samePostingOnTwoPagesIsASessionDuplicate() {
        JobLinkSession session = triageService.openSession();

        LinkDecision first = session.classify(new RawLink("/job/55555", "Analyst", CAREERS));
        LinkDecision second = session.classify(
            new RawLink("https://example.com/job/55555?ref=team", "Analyst", "https://example.com/teams")
        );

        assertThat(first.isAccepted()).isTrue();
        assertThat(second.reason()).isEqualTo(RejectionReason.DUPLICATE_SESSION);
        assertThat(session.acceptedRecords()).hasSize(1);
    }

    @Test
    void historicalKeyIsRejectedAndKeepsItsOriginalDate() {
        LocalDateTime firstSeen = LocalDateTime.parse("2024-01-05T09:30:00");
        JobLinkSession session = triageService.openSession();
        int keys = session.loadHistory(List.of(
            new FoundJob("https://example.com/job/77777", firstSeen),
            new FoundJob("https://example.com/positions/1", firstSeen)
        ));

        LinkDecision decision = session.classify(new RawLink("/job/77777?utm=1", "Analyst", "https://example.com/team"));

        assertThat(keys).isEqualTo(1);
        assertThat(decision.reason()).isEqualTo(RejectionReason.DUPLICATE_HISTORICAL);
        assertThat(session.finalizeRecords()).containsExactly(new FoundJob("https://example.com/job/77777", firstSeen));
    }

    @Test
    void seededKeysBlockAdmission() {
        JobLinkSession session = triageService.openSession();
        session.seedKeys(List.of(new JobKey("example.com", "/opp/424242")));

        LinkDecision decision = session.classify(new RawLink("/OPP/424242", "Analyst", CAREERS));

        assertThat(decision.reason()).isEqualTo(RejectionReason.DUPLICATE_HISTORICAL);
    }

    @Test
    void rerunningWithPreviousOutputAsHistoryFindsNothingNew() {
        List<RawLink> links = List.of(
            new RawLink("/job/11111", "Analyst - Boston", CAREERS),
            new RawLink("/job/22222?src=feed", "Engineer", CAREERS),
            new RawLink("https://acme.tal.net/vx/candidate/so/pm/1/opp/3-Associate", "Associate", CAREERS),
            new RawLink("/job/33333", "Associate - Tokyo", CAREERS),
            new RawLink("/about", "About", CAREERS)
        );

        JobLinkSession firstRun = triageService.openSession();
        links.forEach(firstRun::classify);
        List<FoundJob> firstOutput = firstRun.finalizeRecords();

        JobLinkSession secondRun = triageService.openSession();
        secondRun.loadHistory(firstOutput);
        links.forEach(secondRun::classify);

        assertThat(firstOutput).hasSize(3);
        assertThat(secondRun.acceptedRecords()).isEmpty();
        assertThat(secondRun.finalizeRecords()).isEqualTo(firstOutput);
    }
}
