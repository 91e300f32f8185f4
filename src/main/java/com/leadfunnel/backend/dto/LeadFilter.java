package com.leadfunnel.backend.dto;

import com.leadfunnel.backend.enums.LeadSource;
import com.leadfunnel.backend.enums.LeadStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Optional filters for the admin lead list and export. Null fields do not filter.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeadFilter {
    private String search; // name, case-insensitive substring
    private LeadSource source;
    private LeadStatus status;
    private LocalDate fromDate;
    private LocalDate toDate;

    public void validate() {
        if (fromDate != null && toDate != null && toDate.isBefore(fromDate)) {
            throw new IllegalArgumentException("toDate must not be before fromDate");
        }
    }
}
