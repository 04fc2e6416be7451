package com.di.dataqc.controller.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Request body for POST /api/data/query. The result set becomes a new session named {@link #name},
 * or {@code POSTGRES Query} when absent.
 */
@Data
@NoArgsConstructor
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class QueryRequest extends ConnectionRequest {

    @NotBlank(message = "Query is required")
    private String query;

    private String name;
}
