package com.di.dataqc.formula;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class FormulaResult {

    String formula;

    String resultName;

    String matchBy;

    List<Map<String, Object>> data;

    Map<String, Object> statistics;
}
