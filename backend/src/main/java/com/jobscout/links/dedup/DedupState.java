package com.jobscout.links.dedup;

import com.jobscout.links.model.JobKey;
import com.jobscout.links.model.JobRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Running state of one session: keys known from history (extended as new postings are
 * accepted), keys admitted during this session, the historical records themselves and the
 * records accepted so far. Owned by a single processing thread.
 */
public class DedupState {
    private final KeySet historicalKeys = new KeySet();
    private final KeySet sessionKeys = new KeySet();
    private final List<JobRecord> historicalRecords = new ArrayList<>();
    private final List<JobRecord> acceptedRecords = new ArrayList<>();

    public KeySet historicalKeys() {
        return historicalKeys;
    }

    public KeySet sessionKeys() {
        return sessionKeys;
    }

    public List<JobRecord> historicalRecords() {
        return Collections.unmodifiableList(historicalRecords);
    }

    public List<JobRecord> acceptedRecords() {
        return Collections.unmodifiableList(acceptedRecords);
    }

    /**
     * Adds a persisted record. Records whose key could not be derived are kept so the
     * reconciliation step can account for them, but contribute no key.
     */
    public void addHistorical(JobRecord record) {
        historicalRecords.add(record);
        historicalKeys.add(record.key());
    }

    public void seedHistoricalKey(JobKey key) {
        historicalKeys.add(key);
    }

    void recordAccepted(JobRecord record) {
        acceptedRecords.add(record);
        sessionKeys.add(record.key());
        historicalKeys.add(record.key());
    }
}
