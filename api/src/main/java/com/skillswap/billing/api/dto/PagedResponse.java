package com.skillswap.billing.api.dto;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.List;

/**
 * One page of a larger result set.
 *
 * @param data         Records of the current page only, at most {@code pageSize} of them
 * @param pageNumber   1-based page number
 * @param pageSize     Maximum number of records per page
 * @param totalRecords Total number of records across all pages
 * @param totalPages   Number of pages of {@code pageSize} records
 * @param <T>          element type
 */
public record PagedResponse<T>(
        List<T> data,
        int pageNumber,
        int pageSize,
        long totalRecords,
        int totalPages
) {

    @JsonCreator
    public PagedResponse {
    }

    public PagedResponse(List<T> data, int pageNumber, int pageSize, long totalRecords) {
        this(data, pageNumber, pageSize, totalRecords, pageCount(totalRecords, pageSize));
    }

    private static int pageCount(long totalRecords, int pageSize) {
        return pageSize == 0 ? 0 : (int) ((totalRecords + pageSize - 1) / pageSize);
    }
}
