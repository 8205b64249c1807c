package com.skillswap.billing.api.dto;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PagedResponseTest {

    @Test
    void totalPages_ShouldRoundUpPartialLastPage() {
        assertThat(new PagedResponse<>(List.of("a"), 3, 20, 41).totalPages()).isEqualTo(3);
        assertThat(new PagedResponse<>(List.of(), 1, 20, 40).totalPages()).isEqualTo(2);
    }

    @Test
    void totalPages_WhenNothingMatches_ShouldBeZero() {
        assertThat(new PagedResponse<>(List.of(), 1, 20, 0).totalPages()).isZero();
        assertThat(new PagedResponse<>(List.of(), 1, 0, 5).totalPages()).isZero();
    }
}
