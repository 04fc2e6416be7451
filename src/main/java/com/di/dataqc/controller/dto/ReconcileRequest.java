package com.di.dataqc.controller.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Request body for POST /api/qc/reconcile.
 * <p>
 * {@code tolerance} is a number or {@code {numeric, numeric_type, date, date_unit}}; {@code aggregation} is
 * {@code {enabled, column, function, ...}} or {@code {enabled, aggregations: [...], ...}}. Both are resolved by
 * {@link com.di.dataqc.reconcile.ReconciliationRequestMapper}.
 */
@Data
@NoArgsConstructor
public class ReconcileRequest {

    /** Sessions in order; the first one is the baseline. */
    @Size(min = 2, message = "At least 2 sources are required for reconciliation")
    private List<String> sessionIds = new ArrayList<>();

    @NotEmpty(message = "key_columns is required")
    private List<String> keyColumns = new ArrayList<>();

    private List<String> valueColumns = new ArrayList<>();

    private Object tolerance;

    private Map<String, Object> options;

    private Map<String, Object> analysis;

    private Map<String, Object> aggregation;
}
