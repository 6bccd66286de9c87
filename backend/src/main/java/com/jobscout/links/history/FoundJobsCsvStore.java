package com.jobscout.links.history;

import com.jobscout.config.ScoutProperties;
import com.jobscout.links.model.FoundJob;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Found-jobs list persisted as CSV with a {@code JobLink,DateFound} header.
 */
@Component
public class FoundJobsCsvStore {
    private static final Logger log = LoggerFactory.getLogger(FoundJobsCsvStore.class);

    public static final String JOB_LINK_COLUMN = "JobLink";
    public static final String DATE_COLUMN = "DateFound";
    public static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Path path;

    @Autowired
    public FoundJobsCsvStore(ScoutProperties properties) {
        this(resolvePath(properties.getHistory().getPath()));
    }

    public FoundJobsCsvStore(Path path) {
        this.path = path;
    }

    public Path path() {
        return path;
    }

    /**
     * @return persisted rows in file order; empty when the file does not exist yet
     * @throws IOException when the file exists but cannot be read or lacks the link column
     */
    public List<FoundJob> load() throws IOException {
        if (!Files.exists(path)) {
            log.info("History file {} not found, starting fresh", path);
            return List.of();
        }
        List<FoundJob> rows = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVParser parser = csvParser(reader)) {
            String linkHeader = findHeader(parser.getHeaderNames(), JOB_LINK_COLUMN);
            if (linkHeader == null) {
                throw new IOException("column '" + JOB_LINK_COLUMN + "' not found in " + path);
            }
            String dateHeader = findHeader(parser.getHeaderNames(), DATE_COLUMN);
            for (CSVRecord record : parser) {
                String url = record.isSet(linkHeader) ? record.get(linkHeader) : null;
                if (url == null || url.isBlank()) {
                    continue;
                }
                String rawDate = dateHeader != null && record.isSet(dateHeader) ? record.get(dateHeader) : null;
                LocalDateTime firstSeen = parseDate(rawDate);
                if (firstSeen == null && rawDate != null && !rawDate.isBlank()) {
                    log.warn("Unreadable {} '{}' on row {} of {}", DATE_COLUMN, rawDate, record.getRecordNumber(), path);
                }
                rows.add(new FoundJob(url, firstSeen));
            }
        } catch (UncheckedIOException | IllegalArgumentException | IllegalStateException e) {
            // record iteration reports parse errors unchecked
            throw new IOException("malformed CSV in " + path + ": " + e.getMessage(), e);
        }
        return rows;
    }

    /**
     * Replaces the file contents atomically: rows are written to a sibling temp file first.
     */
    public void save(List<FoundJob> rows) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tmp = Files.createTempFile(parent, path.getFileName().toString(), ".tmp");
        try {
            CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader(JOB_LINK_COLUMN, DATE_COLUMN)
                .build();
            try (Writer writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8);
                 CSVPrinter printer = new CSVPrinter(writer, format)) {
                for (FoundJob row : rows) {
                    printer.printRecord(row.url(), row.firstSeen() == null ? "" : DATE_FORMAT.format(row.firstSeen()));
                }
            }
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    static LocalDateTime parseDate(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim();
        try {
            return LocalDateTime.parse(value, DATE_FORMAT);
        } catch (DateTimeParseException ignored) {
            // fall through to the other accepted shapes
        }
        try {
            return LocalDateTime.parse(value);
        } catch (DateTimeParseException ignored) {
            // fall through
        }
        try {
            return LocalDate.parse(value).atStartOfDay();
        } catch (DateTimeParseException ignored) {
            return null;
        }
    }

    private CSVParser csvParser(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreEmptyLines(true)
            .build();
        return format.parse(reader);
    }

    private String findHeader(List<String> headers, String name) {
        for (String header : headers) {
            if (header != null && header.trim().equalsIgnoreCase(name)) {
                return header;
            }
        }
        return null;
    }

    static Path resolvePath(String configuredPath) {
        Path path = Paths.get(configuredPath);
        if (path.isAbsolute()) {
            return path.normalize();
        }
        return Paths.get("").toAbsolutePath().resolve(path).normalize();
    }
}
