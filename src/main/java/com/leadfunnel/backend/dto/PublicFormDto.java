package com.leadfunnel.backend.dto;

import com.leadfunnel.backend.models.Form;
import lombok.Builder;
import lombok.Data;

/**
 * The part of a form visitors may see.
 */
@Data
@Builder
public class PublicFormDto {
    private Long id;
    private String name;
    private String description;

    public static PublicFormDto from(Form form) {
        return PublicFormDto.builder()
                .id(form.getId())
                .name(form.getName())
                .description(form.getDescription())
                .build();
    }
}
