package com.di.dataqc.rule;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One entry of a rule batch: which rule to run and with what options.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RuleRequest {

    private String ruleId;

    private Map<String, Object> config = new LinkedHashMap<>();
}
