package com.jobscout.links.history;

import com.jobscout.links.model.FoundJob;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FoundJobsCsvStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void missingFileLoadsAsEmpty() throws Exception {
        FoundJobsCsvStore store = new FoundJobsCsvStore(tempDir.resolve("found_jobs.csv"));

        assertThat(store.load()).isEmpty();
    }

    @Test
    void savedRowsAreReadBackInOrder() throws Exception {
        Path file = tempDir.resolve("nested/found_jobs.csv");
        FoundJobsCsvStore store = new FoundJobsCsvStore(file);
        List<FoundJob> rows = List.of(
            new FoundJob("https://example.com/job/77777", LocalDateTime.parse("2024-01-05T09:30:00")),
            new FoundJob("https://example.com/job/88888,senior", null)
        );

        store.save(rows);

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertThat(lines.get(0)).isEqualTo("JobLink,DateFound");
        assertThat(lines.get(1)).isEqualTo("https://example.com/job/77777,2024-01-05 09:30:00");
        assertThat(store.load()).containsExactlyElementsOf(rows);
        try (var listing = Files.list(file.getParent())) {
            assertThat(listing).containsExactly(file);
        }
    }

    @Test
    void fileWithoutLinkColumnIsRejected() throws Exception {
        Path file = tempDir.resolve("found_jobs.csv");
        Files.writeString(file, "Url,DateFound\nhttps://example.com/job/1,2024-01-05 09:30:00\n");

        assertThatThrownBy(() -> new FoundJobsCsvStore(file).load())
            .isInstanceOf(IOException.class)
            .hasMessageContaining("JobLink");
    }

    @Test
    void unreadableDateKeepsTheRow() throws Exception {
        Path file = tempDir.resolve("found_jobs.csv");
        Files.writeString(file, String.join("\n",
            "JobLink,DateFound",
            "https://example.com/job/11111,last tuesday",
            "https://example.com/job/22222,2024-02-10",
            "https://example.com/job/33333,2024-02-10T08:00:00",
            ",2024-02-10 08:00:00",
            ""
        ));

        List<FoundJob> rows = new FoundJobsCsvStore(file).load();

        assertThat(rows).containsExactly(
            new FoundJob("https://example.com/job/11111", null),
            new FoundJob("https://example.com/job/22222", LocalDateTime.parse("2024-02-10T00:00:00")),
            new FoundJob("https://example.com/job/33333", LocalDateTime.parse("2024-02-10T08:00:00"))
        );
    }

    @Test
    void unterminatedQuoteIsReportedAsIOException() throws Exception {
        Path file = tempDir.resolve("found_jobs.csv");
        Files.writeString(file, String.join("\n",
            "JobLink,DateFound",
            "https://example.com/job/1,2024-01-05 09:30:00",
            "\"https://example.com/job/2,2024-01-05",
            ""
        ));

        assertThatThrownBy(() -> new FoundJobsCsvStore(file).load())
            .isInstanceOf(IOException.class)
            .hasMessageContaining("malformed CSV");
    }

    @Test
    void linkOnlyFileLoadsWithoutDates() throws Exception {
        Path file = tempDir.resolve("found_jobs.csv");
        Files.writeString(file, "JobLink\nhttps://example.com/job/11111\n");

        assertThat(new FoundJobsCsvStore(file).load())
            .containsExactly(new FoundJob("https://example.com/job/11111", null));
    }
}
