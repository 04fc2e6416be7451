package com.di.dataqc.controller.dto;

import com.di.dataqc.dataset.Column;
import com.di.dataqc.store.DatasetSession;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A loaded session without its data.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceSummary {

    private String sourceId;
    private String name;
    private String sourceType;
    /** File name or query text. */
    private String origin;
    private List<String> columns;
    /** Column name to logical type label. */
    private Map<String, String> dtypes;
    private int rowCount;
    private String createdAt;

    public static SourceSummary of(DatasetSession session) {
        Map<String, String> dtypes = new LinkedHashMap<>();
        for (Column column : session.getDataset().columns()) {
            dtypes.put(column.name(), column.type().label());
        }
        return SourceSummary.builder()
                .sourceId(session.getId())
                .name(session.getName())
                .sourceType(session.getSourceType())
                .origin(session.getOrigin())
                .columns(session.getDataset().columnNames())
                .dtypes(dtypes)
                .rowCount(session.getDataset().rowCount())
                .createdAt(session.getCreatedAt().toString())
                .build();
    }
}
