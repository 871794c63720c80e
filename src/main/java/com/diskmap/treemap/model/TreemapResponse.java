package com.diskmap.treemap.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TreemapResponse {

    private NodeSummary root;

    private ScanStatus status;

    private Double canvasWidth;

    private Double canvasHeight;

    @Builder.Default
    private List<TreemapRect> rects = new ArrayList<>();

    private Long scanTimeMs;

    private Long layoutTimeMs;
}
