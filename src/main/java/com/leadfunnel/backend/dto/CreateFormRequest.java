package com.leadfunnel.backend.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class CreateFormRequest {

    @NotBlank(message = "Form name is required")
    @Size(max = 255)
    private String name;

    private String description;

    private Boolean active;
}
