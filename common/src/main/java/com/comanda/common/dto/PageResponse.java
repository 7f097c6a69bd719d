package com.comanda.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One page of results plus the paging metadata. Pages are 1-based.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PageResponse<T> {

    private List<T> data;
    private Meta meta;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Meta {
        private long total;
        private int page;
        private int limit;
        private int totalPages;
    }

    public static <T> PageResponse<T> of(List<T> data, long total, int page, int limit) {
        int totalPages = limit == 0 ? 0 : (int) ((total + limit - 1) / limit);
        return PageResponse.<T>builder()
                .data(data)
                .meta(Meta.builder()
                        .total(total)
                        .page(page)
                        .limit(limit)
                        .totalPages(totalPages)
                        .build())
                .build();
    }
}
