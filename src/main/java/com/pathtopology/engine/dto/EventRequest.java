package com.pathtopology.engine.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Manual event located by its links.
 *
 * @param kind   user kind (SIGNAGE, TREK...); boundary kinds are reserved
 * @param offset signed lateral offset, positive to the left; null means on the path
 * @param links  links in route order
 */
public record EventRequest(
    @NotBlank(message = "Event kind is required")
    @Size(max = 64, message = "Event kind must be at most 64 characters")
    String kind,

    Double offset,

    @NotEmpty(message = "At least one link is required")
    @Valid
    List<LinkRequest> links
) {

    public double offsetOrZero() {
        return offset == null ? 0.0 : offset;
    }
}
