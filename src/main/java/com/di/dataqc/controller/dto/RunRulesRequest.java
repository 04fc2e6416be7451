package com.di.dataqc.controller.dto;

import com.di.dataqc.rule.RuleRequest;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Request body for POST /api/qc/run: rules to run, in order, against one session.
 */
@Data
@NoArgsConstructor
public class RunRulesRequest {

    @NotBlank(message = "session_id is required")
    private String sessionId;

    @NotEmpty(message = "At least one rule is required")
    private List<RuleRequest> rules = new ArrayList<>();
}
