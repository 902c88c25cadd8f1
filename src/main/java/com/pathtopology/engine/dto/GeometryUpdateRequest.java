package com.pathtopology.engine.dto;

import jakarta.validation.constraints.NotBlank;

public record GeometryUpdateRequest(
    @NotBlank(message = "Segment geometry is required")
    String wkt
) {
}
