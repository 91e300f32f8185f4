package com.leadfunnel.backend.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class FormEmbedDto {
    private String embedCode; // iframe snippet
    private String directLink;
}
