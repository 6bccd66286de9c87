package com.jobscout.links.classify;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GeographyFilterTest {
    private static final String NEUTRAL_URL = "https://example.com/job/12345";

    private final GeographyFilter filter =
        new GeographyFilter(LocationKeywords.DEFAULT_ALLOWED, LocationKeywords.DEFAULT_DISALLOWED);

    @Test
    void disallowedCityInAnchorTextRejects() {
        assertThat(filter.isDisallowed(NEUTRAL_URL, "London, UK")).isTrue();
    }

    @Test
    void allowedKeywordOverridesDisallowedOne() {
        assertThat(filter.isDisallowed(NEUTRAL_URL, "New York, NY / London")).isFalse();
        assertThat(filter.isDisallowed("https://example.com/job/us/12345", "Analyst - London")).isFalse();
    }

    @Test
    void noLocationEvidenceKeepsTheLink() {
        assertThat(filter.isDisallowed(NEUTRAL_URL, "Senior Analyst")).isFalse();
        assertThat(filter.isDisallowed(NEUTRAL_URL, null)).isFalse();
    }

    @Test
    void shortKeywordsDoNotMatchInsideWords() {
        assertThat(filter.isDisallowed(NEUTRAL_URL, "Staff Engineer - Toronto")).isTrue();
        assertThat(filter.findAllowed(GeographyFilter.buildCorpus(NEUTRAL_URL, "Staff Engineer"))).isEmpty();
        assertThat(filter.isDisallowed(NEUTRAL_URL, "Measurement Analyst")).isFalse();
    }

    @Test
    void listSeparatorsInAnchorTextActAsBoundaries() {
        assertThat(GeographyFilter.buildCorpus("https://Example.com/job/1", "Paris,(France)/Remote"))
            .isEqualTo("https://example.com/job/1 paris  france  remote");
        assertThat(filter.isDisallowed(NEUTRAL_URL, "Analyst(Paris)")).isTrue();
    }

    @Test
    void localePathSegmentInUrlRejects() {
        assertThat(filter.isDisallowed("https://example.com/fr-fr/job/12345", "Analyst")).isTrue();
    }

    @Test
    void localePathSegmentOnlyCountsInTheUrl() {
        assertThat(filter.isDisallowed(NEUTRAL_URL, "see /de-de site")).isFalse();
    }

    @Test
    void keywordListsCanBeReplaced() {
        GeographyFilter custom = new GeographyFilter(List.of(" Remote "), List.of("Berlin"));
        assertThat(custom.isDisallowed(NEUTRAL_URL, "Engineer - Berlin")).isTrue();
        assertThat(custom.isDisallowed(NEUTRAL_URL, "Remote - Berlin")).isFalse();
        assertThat(custom.isDisallowed(NEUTRAL_URL, "London")).isFalse();
    }
}
