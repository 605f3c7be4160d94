package com.umitunal.stepflow.model;

import java.util.List;
import java.util.Map;

/**
 * Digest state of a DIGEST job: the grouping key, the events merged into it
 * so far, and the main digest job it was merged into, if any.
 */
public final class DigestMetadata {
    private final String digestKey;
    private final List<Map<String, Object>> events;
    private final String mergedDigestId;

    public DigestMetadata(String digestKey, List<Map<String, Object>> events, String mergedDigestId) {
        this.digestKey = digestKey;
        this.events = events == null ? List.of() : List.copyOf(events);
        this.mergedDigestId = mergedDigestId;
    }

    public String getDigestKey() { return digestKey; }
    public List<Map<String, Object>> getEvents() { return events; }
    public String getMergedDigestId() { return mergedDigestId; }
}
