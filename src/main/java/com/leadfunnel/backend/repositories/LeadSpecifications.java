package com.leadfunnel.backend.repositories;

import com.leadfunnel.backend.dto.LeadFilter;
import com.leadfunnel.backend.models.Lead;
import org.springframework.data.jpa.domain.Specification;

import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.Locale;

/**
 * Builds the lead list query from the optional admin filters. Date bounds are
 * whole days in the given zone, both inclusive.
 */
public final class LeadSpecifications {

    private LeadSpecifications() {
    }

    public static Specification<Lead> fromFilter(LeadFilter filter, ZoneId zone) {
        Specification<Lead> spec = Specification.where(null);

        if (filter.getSearch() != null && !filter.getSearch().isBlank()) {
            String pattern = "%" + filter.getSearch().trim().toLowerCase(Locale.ROOT) + "%";
            spec = spec.and((root, query, cb) -> cb.like(cb.lower(root.get("name")), pattern));
        }

        if (filter.getSource() != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("source"), filter.getSource()));
        }

        if (filter.getStatus() != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("status"), filter.getStatus()));
        }

        if (filter.getFromDate() != null) {
            OffsetDateTime from = filter.getFromDate().atStartOfDay(zone).toOffsetDateTime();
            spec = spec.and((root, query, cb) -> cb.greaterThanOrEqualTo(root.get("createdAt"), from));
        }

        if (filter.getToDate() != null) {
            OffsetDateTime before = filter.getToDate().plusDays(1).atStartOfDay(zone).toOffsetDateTime();
            spec = spec.and((root, query, cb) -> cb.lessThan(root.get("createdAt"), before));
        }

        return spec;
    }
}
