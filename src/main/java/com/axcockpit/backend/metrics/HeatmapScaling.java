package com.axcockpit.backend.metrics;

/**
 * 히트맵 강도 계산 방식.
 * LINEAR: value / max, QUARTILE: 0, 0.25, 0.5, 0.75, 1 다섯 단계
 */
public enum HeatmapScaling {
    LINEAR,
    QUARTILE
}
