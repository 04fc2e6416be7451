package com.di.dataqc.controller.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Request body for POST /api/qc/compare. With {@code key_columns} rows are matched by key, otherwise by position.
 */
@Data
@NoArgsConstructor
public class CompareRequest {

    @NotBlank(message = "source_id is required")
    private String sourceId;

    @NotBlank(message = "target_id is required")
    private String targetId;

    private List<String> keyColumns = new ArrayList<>();

    /** Restricts the compared columns; empty means all common columns. */
    private List<String> compareColumns = new ArrayList<>();

    @PositiveOrZero(message = "tolerance must not be negative")
    private double tolerance;

    private boolean ignoreCase;

    private boolean ignoreWhitespace;
}
