package com.leadfunnel.backend.dto;

import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * Partial update: null fields are left unchanged.
 */
@Data
public class UpdateFormRequest {

    @Size(max = 255)
    private String name;

    private String description;

    private Boolean active;
}
