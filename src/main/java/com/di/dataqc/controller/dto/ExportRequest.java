package com.di.dataqc.controller.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class ExportRequest {

    @NotBlank(message = "result_id is required")
    private String resultId;

    private boolean includeFailedRows = true;
}
