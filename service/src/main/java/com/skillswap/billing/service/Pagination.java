package com.skillswap.billing.service;

final class Pagination {

    static final int MAX_PAGE_SIZE = 100;

    private Pagination() {
    }

    /**
     * @throws IllegalArgumentException if page is below 1 or size is outside 1..100
     */
    static void validate(int page, int size) {
        if (page < 1) {
            throw new IllegalArgumentException("Page must be 1 or greater");
        }
        if (size < 1 || size > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("Page size must be between 1 and " + MAX_PAGE_SIZE);
        }
    }
}
