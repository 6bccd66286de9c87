package com.jobscout.links.dedup;

import com.jobscout.links.model.FoundJob;
import com.jobscout.links.model.JobKey;
import com.jobscout.links.model.JobRecord;
import com.jobscout.links.model.LinkDecision;
import com.jobscout.links.model.RejectionReason;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Admits classified, location-approved postings into a {@link DedupState} and reconciles the
 * accepted records with the historical ones at the end of a session.
 */
@Component
public class DedupMerger {

    /**
     * @param key derived key of the candidate, or null when the URL was unkeyable
     */
    public LinkDecision admit(DedupState state, String url, JobKey key, LocalDateTime now) {
        if (key == null) {
            return LinkDecision.rejected(url, RejectionReason.NO_KEY);
        }
        if (state.sessionKeys().contains(key)) {
            return LinkDecision.rejected(url, RejectionReason.DUPLICATE_SESSION);
        }
        if (state.historicalKeys().contains(key)) {
            return LinkDecision.rejected(url, RejectionReason.DUPLICATE_HISTORICAL);
        }
        JobRecord record = new JobRecord(url, now, key);
        state.recordAccepted(record);
        return LinkDecision.accepted(record);
    }

    /**
     * Historical records followed by accepted ones, unkeyed records dropped, first occurrence
     * of each key kept, projected to the external row shape.
     */
    public List<FoundJob> reconcile(DedupState state) {
        List<JobRecord> combined = new ArrayList<>(state.historicalRecords());
        combined.addAll(state.acceptedRecords());

        Map<JobKey, JobRecord> firstByKey = new LinkedHashMap<>();
        for (JobRecord record : combined) {
            if (record.key() == null) {
                continue;
            }
            firstByKey.putIfAbsent(record.key(), record);
        }
        List<FoundJob> out = new ArrayList<>(firstByKey.size());
        for (JobRecord record : firstByKey.values()) {
            out.add(record.toFoundJob());
        }
        return out;
    }
}
