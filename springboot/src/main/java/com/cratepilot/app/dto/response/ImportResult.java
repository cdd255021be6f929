package com.cratepilot.app.dto.response;

import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Summary of one import request. Duplicates are warnings; records that could not be normalized
 * and upstream failures are errors. Only the {@code record*} methods change a result; the list
 * views are read-only.
 */
@Getter
@ToString
public class ImportResult {

    private int imported;
    private int failed;
    private final List<String> importedTrackIds = new ArrayList<>();
    private final Set<String> resolvedTrackIds = new LinkedHashSet<>();
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    public static ImportResult empty() {
        return new ImportResult();
    }

    public static ImportResult failure(String error, int failedCount) {
        ImportResult result = new ImportResult();
        result.failed = failedCount;
        result.errors.add(error);
        return result;
    }

    public static ImportResult warning(String warning) {
        ImportResult result = new ImportResult();
        result.warnings.add(warning);
        return result;
    }

    public boolean isSuccess() {
        return errors.isEmpty();
    }

    public void recordImported(String trackId) {
        imported++;
        importedTrackIds.add(trackId);
        resolvedTrackIds.add(trackId);
    }

    public void recordDuplicate(String trackId) {
        resolvedTrackIds.add(trackId);
        warnings.add("Track already exists: " + trackId);
    }

    public void recordFailure(String error) {
        failed++;
        errors.add(error);
    }

    public List<String> getImportedTrackIds() {
        return Collections.unmodifiableList(importedTrackIds);
    }

    public Set<String> getResolvedTrackIds() {
        return Collections.unmodifiableSet(resolvedTrackIds);
    }

    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }
}
