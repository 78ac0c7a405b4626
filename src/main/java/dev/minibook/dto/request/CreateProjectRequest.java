package dev.minibook.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateProjectRequest(@NotBlank @Size(max = 200) String name,
                                   @Size(max = 4000) String description) {
}
