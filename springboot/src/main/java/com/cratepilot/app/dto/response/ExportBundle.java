package com.cratepilot.app.dto.response;

import com.cratepilot.app.entity.Track;
import com.cratepilot.app.model.ExportOptions;
import lombok.Value;

import java.util.List;

/**
 * A finalized plan resolved to full track records, ready for a playlist writer.
 */
@Value
public class ExportBundle {
    Long planId;
    List<Track> tracks;
    ExportOptions options;
    List<String> issues;

    public boolean hasIssues() {
        return !issues.isEmpty();
    }
}
