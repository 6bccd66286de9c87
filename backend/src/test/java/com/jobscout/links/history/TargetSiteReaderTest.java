package com.jobscout.links.history;

import com.jobscout.links.service.TargetListUnavailableException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TargetSiteReaderTest {

    @TempDir
    Path tempDir;

    @Test
    void readsConfiguredColumnAndSkipsInvalidRows() throws Exception {
        Path file = tempDir.resolve("job_sites.csv");
        Files.writeString(file, String.join("\n",
            "name,url",
            "Example,https://example.com/careers",
            "Broken,not a url",
            "Other, http://other.example.org/jobs ",
            ""
        ));

        List<String> targets = new TargetSiteReader(file, "url").read();

        assertThat(targets).containsExactly("https://example.com/careers", "http://other.example.org/jobs");
    }

    @Test
    void fileWithoutHeaderRowKeepsFirstTarget() throws Exception {
        Path file = tempDir.resolve("job_sites.csv");
        Files.writeString(file, "https://example.com/careers\nhttps://other.example.org/jobs\n");

        assertThat(new TargetSiteReader(file, "url").read())
            .containsExactly("https://example.com/careers", "https://other.example.org/jobs");
    }

    @Test
    void unknownColumnFallsBackToFirstColumn() throws Exception {
        Path file = tempDir.resolve("job_sites.csv");
        Files.writeString(file, "site,notes\nhttps://example.com/careers,main board\n");

        assertThat(new TargetSiteReader(file, "url").read()).containsExactly("https://example.com/careers");
    }

    @Test
    void missingFileIsUnavailable() {
        TargetSiteReader reader = new TargetSiteReader(tempDir.resolve("absent.csv"), "url");

        assertThatThrownBy(reader::read)
            .isInstanceOf(TargetListUnavailableException.class)
            .hasMessageContaining("absent.csv");
    }

    @Test
    void unterminatedQuoteIsUnavailable() throws Exception {
        Path file = tempDir.resolve("job_sites.csv");
        Files.writeString(file, "url\nhttps://example.com/careers\n\"https://other.example.org/jobs\n");

        assertThatThrownBy(() -> new TargetSiteReader(file, "url").read())
            .isInstanceOf(TargetListUnavailableException.class)
            .hasMessageContaining("could not read target list");
    }

    @Test
    void sanitizeKeepsOnlyHttpTargets() {
        assertThat(TargetSiteReader.sanitize(Arrays.asList(null, "", "ftp://x.example.com", " HTTPS://Example.com/Jobs ")))
            .containsExactly("HTTPS://Example.com/Jobs");
        assertThat(TargetSiteReader.sanitize(null)).isEmpty();
    }
}
