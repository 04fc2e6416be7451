package com.di.dataqc.controller.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PreviewResponse {

    private String sourceId;
    private List<String> columns;
    private int totalRows;
    private int offset;
    private int limit;
    private List<Map<String, Object>> data;
}
