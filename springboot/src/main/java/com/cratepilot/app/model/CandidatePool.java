package com.cratepilot.app.model;

import com.cratepilot.app.entity.CratePrompt;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Unordered set of track ids gathered for one intent. Edits return a new pool.
 */
@Value
@Builder(toBuilder = true)
public class CandidatePool {

    public enum Origin { EXTERNAL_SEARCH, CATALOG_QUERY, LLM_SELECTION }

    CratePrompt sourcePrompt;
    Set<String> trackIds;
    String filtersApplied;
    Origin origin;

    public static CandidatePool of(CratePrompt prompt, Set<String> trackIds, String filtersApplied, Origin origin) {
        return new CandidatePool(prompt, Collections.unmodifiableSet(new LinkedHashSet<>(trackIds)), filtersApplied, origin);
    }

    public boolean contains(String trackId) {
        return trackIds.contains(trackId);
    }

    public int size() {
        return trackIds.size();
    }

    public boolean isEmpty() {
        return trackIds.isEmpty();
    }

    public CandidatePool withTrack(String trackId) {
        Set<String> ids = new LinkedHashSet<>(trackIds);
        ids.add(trackId);
        return of(sourcePrompt, ids, filtersApplied, origin);
    }

    public CandidatePool withoutTrack(String trackId) {
        Set<String> ids = new LinkedHashSet<>(trackIds);
        ids.remove(trackId);
        return of(sourcePrompt, ids, filtersApplied, origin);
    }
}
