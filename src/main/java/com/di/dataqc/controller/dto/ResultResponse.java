package com.di.dataqc.controller.dto;

import com.di.dataqc.store.StoredResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A stored result as returned by the QC endpoints; {@code result_id} is the handle for export.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResultResponse {

    private String resultId;
    private String type;
    private List<String> sourceIds;
    private String createdAt;
    private Object result;

    public static ResultResponse of(StoredResult stored) {
        return ResultResponse.builder()
                .resultId(stored.getId())
                .type(stored.getType().id())
                .sourceIds(stored.getSourceIds())
                .createdAt(stored.getCreatedAt().toString())
                .result(stored.getPayload())
                .build();
    }
}
