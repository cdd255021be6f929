package com.cratepilot.app.service;

import com.cratepilot.app.dto.response.ExportBundle;
import com.cratepilot.app.entity.CratePlan;
import com.cratepilot.app.entity.Track;
import com.cratepilot.app.exception.InvalidInputException;
import com.cratepilot.app.model.ExportOptions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Gate in front of playlist writers: only finalized plans pass, resolved to tracks in plan order.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PlanExportService {

    private final TrackCatalog catalog;
    private final ConstraintValidator validator;

    public ExportBundle prepare(CratePlan plan, ExportOptions options) {
        if (!plan.isFinalized()) {
            throw new InvalidInputException("Only finalized plans can be exported");
        }
        if (options == null || options.getFormat() == null) {
            throw new InvalidInputException("Export format is required");
        }

        Map<String, Track> byId = catalog.findAllById(plan.getTrackList()).stream()
                .collect(Collectors.toMap(Track::getId, Function.identity()));

        List<Track> tracks = new ArrayList<>();
        List<String> issues = new ArrayList<>();
        for (String id : plan.getTrackList()) {
            Track track = byId.get(id);
            if (track == null) {
                issues.add("Track not found in catalog: " + id);
                continue;
            }
            tracks.add(track);
            issues.addAll(validator.validateTrackForExport(track).getErrors());
        }

        if (!issues.isEmpty()) {
            log.warn("Export of plan {} as {} has {} issue(s)", plan.getId(), options.getFormat(), issues.size());
        }
        return new ExportBundle(plan.getId(), tracks, options, List.copyOf(issues));
    }
}
