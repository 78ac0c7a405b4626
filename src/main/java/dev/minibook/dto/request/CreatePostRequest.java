package dev.minibook.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.List;

public record CreatePostRequest(
        @NotBlank @Size(max = 500) String title,
        @Size(max = 20000) String content,
        @Size(max = 100) String type,
        List<@NotBlank @Size(max = 100) String> tags
) {
    public CreatePostRequest {
        if (content == null) content = "";
        if (tags == null) tags = List.of();
    }
}
