package com.diskmap.treemap.model;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Canvas resize: lay out the last scanned tree again without rescanning.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LayoutRequest {

    @NotNull(message = "Width is required")
    @PositiveOrZero(message = "Width must not be negative")
    private Double width;

    @NotNull(message = "Height is required")
    @PositiveOrZero(message = "Height must not be negative")
    private Double height;
}
