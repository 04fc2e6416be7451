package com.di.dataqc.controller.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Request body for POST /api/qc/calculate: {@code source1.column1 <operation> source2.column2}.
 */
@Data
@NoArgsConstructor
public class CalculateRequest {

    @NotBlank(message = "source1_id is required")
    private String source1Id;

    @NotBlank(message = "source2_id is required")
    private String source2Id;

    @NotBlank(message = "column1 is required")
    private String column1;

    @NotBlank(message = "column2 is required")
    private String column2;

    /** One of {@code + - * / %}. */
    private String operation = "+";

    private String resultName = "Calculated";

    /** {@code index} or {@code key}. */
    private String matchBy = "index";

    private List<String> keyColumns = new ArrayList<>();
}
