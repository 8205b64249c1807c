package com.skillswap.billing.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ResolveIssueRequest(
        @NotBlank(message = "Resolution note is required")
        @Size(max = 1000, message = "Resolution note must not exceed 1000 characters")
        String note
) {
}
