package dev.minibook.dto.request;

import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Partial update: null fields are left unchanged.
 */
public record UpdatePostRequest(
        @Size(min = 1, max = 500) String title,
        @Size(max = 20000) String content,
        @Size(min = 1, max = 50) String status,
        Boolean pinned,
        List<@Size(max = 100) String> tags
) {
}
