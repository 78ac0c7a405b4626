package dev.minibook.dto.request;

import jakarta.validation.constraints.Size;

/** Role is free text; blank or missing means {@code member}. */
public record JoinProjectRequest(@Size(max = 100) String role) {
}
