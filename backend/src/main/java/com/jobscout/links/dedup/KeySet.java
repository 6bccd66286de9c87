package com.jobscout.links.dedup;

import com.jobscout.links.model.JobKey;

import java.util.LinkedHashSet;
import java.util.Set;

public class KeySet {
    private final Set<JobKey> keys = new LinkedHashSet<>();

    public boolean contains(JobKey key) {
        return key != null && keys.contains(key);
    }

    /**
     * @return true when the key was not present before
     */
    public boolean add(JobKey key) {
        if (key == null) {
            return false;
        }
        return keys.add(key);
    }

    public int size() {
        return keys.size();
    }
}
