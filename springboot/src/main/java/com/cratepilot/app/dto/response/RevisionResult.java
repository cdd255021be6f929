package com.cratepilot.app.dto.response;

import com.cratepilot.app.entity.CratePlan;
import lombok.Value;

import java.util.List;

@Value
public class RevisionResult {
    CratePlan plan;
    String changesExplanation;
    List<String> warnings;
}
