package com.jobscout.links.history;

import com.jobscout.config.ScoutProperties;
import com.jobscout.links.service.TargetListUnavailableException;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.csv.DuplicateHeaderMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Reads the list of career pages to visit from a CSV file. The configured column is used when
 * the header has it, otherwise the first column.
 */
@Component
public class TargetSiteReader {
    private static final Logger log = LoggerFactory.getLogger(TargetSiteReader.class);

    private final Path path;
    private final String column;

    @Autowired
    public TargetSiteReader(ScoutProperties properties) {
        this(FoundJobsCsvStore.resolvePath(properties.getTargets().getPath()), properties.getTargets().getColumn());
    }

    public TargetSiteReader(Path path, String column) {
        this.path = path;
        this.column = column;
    }

    public List<String> read() {
        if (!Files.exists(path)) {
            throw new TargetListUnavailableException("target list " + path + " not found");
        }
        List<String> raw = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVParser parser = csvParser(reader)) {
            List<String> headers = parser.getHeaderNames();
            int columnIndex = columnIndex(headers);
            // a file without a header row starts straight with a target
            if (columnIndex < headers.size() && looksLikeUrl(headers.get(columnIndex))) {
                raw.add(headers.get(columnIndex));
            }
            for (CSVRecord record : parser) {
                if (record.size() > columnIndex) {
                    raw.add(record.get(columnIndex));
                }
            }
        } catch (IOException | UncheckedIOException | IllegalArgumentException | IllegalStateException e) {
            throw new TargetListUnavailableException("could not read target list " + path + ": " + e.getMessage(), e);
        }
        return sanitize(raw);
    }

    /**
     * Drops blank and non-http(s) entries, keeping order.
     */
    public static List<String> sanitize(Collection<String> candidates) {
        List<String> targets = new ArrayList<>();
        if (candidates == null) {
            return targets;
        }
        for (String candidate : candidates) {
            String value = candidate == null ? "" : candidate.trim();
            String lower = value.toLowerCase(Locale.ROOT);
            if (!lower.startsWith("http://") && !lower.startsWith("https://")) {
                if (!value.isEmpty()) {
                    log.warn("Skipping invalid target URL: {}", value);
                }
                continue;
            }
            targets.add(value);
        }
        return targets;
    }

    private static boolean looksLikeUrl(String value) {
        if (value == null) {
            return false;
        }
        String lower = value.trim().toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://");
    }

    private int columnIndex(List<String> headers) {
        if (column == null || column.isBlank()) {
            return 0;
        }
        for (int i = 0; i < headers.size(); i++) {
            String header = headers.get(i);
            if (header != null && header.trim().equalsIgnoreCase(column.trim())) {
                return i;
            }
        }
        return 0;
    }

    private CSVParser csvParser(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreSurroundingSpaces(true)
            .setIgnoreEmptyLines(true)
            .setAllowMissingColumnNames(true)
            .setDuplicateHeaderMode(DuplicateHeaderMode.ALLOW_ALL)
            .build();
        return format.parse(reader);
    }
}
