package com.diskmap.treemap.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TreemapRequest {

    @NotBlank(message = "Path is required")
    private String path;

    @PositiveOrZero(message = "Width must not be negative")
    private Double width;

    @PositiveOrZero(message = "Height must not be negative")
    private Double height;
}
