package com.di.dataqc.controller.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class RenameRequest {

    @NotBlank(message = "Name is required")
    private String name;
}
