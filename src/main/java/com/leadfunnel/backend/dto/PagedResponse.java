package com.leadfunnel.backend.dto;

import lombok.Builder;
import lombok.Data;
import org.springframework.data.domain.Page;

import java.util.List;

@Data
@Builder
public class PagedResponse<T> {
    private List<T> data;
    private Meta meta;

    @Data
    @Builder
    public static class Meta {
        private Integer currentPage; // 1-based
        private Integer totalPages;
        private Long totalItems;
        private Integer itemsPerPage;
    }

    public static <T> PagedResponse<T> from(Page<T> page) {
        return PagedResponse.<T>builder()
                .data(page.getContent())
                .meta(Meta.builder()
                        .currentPage(page.getNumber() + 1)
                        .totalPages(page.getTotalPages())
                        .totalItems(page.getTotalElements())
                        .itemsPerPage(page.getSize())
                        .build())
                .build();
    }
}
