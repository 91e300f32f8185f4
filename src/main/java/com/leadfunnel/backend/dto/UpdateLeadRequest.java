package com.leadfunnel.backend.dto;

import com.leadfunnel.backend.enums.LeadSource;
import com.leadfunnel.backend.enums.LeadStatus;
import jakarta.validation.constraints.Email;
import lombok.Data;

/**
 * Partial update: null fields are left unchanged.
 */
@Data
public class UpdateLeadRequest {

    private String name;

    @Email(message = "Invalid email format")
    private String email;

    private String phone;

    private String age;

    private String education;

    private String college;

    private String state;

    private String city;

    private LeadSource source;

    private LeadStatus status;
}
