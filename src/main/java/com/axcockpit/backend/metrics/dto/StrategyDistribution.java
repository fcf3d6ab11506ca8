package com.axcockpit.backend.metrics.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StrategyDistribution {
    private List<StrategyShare> strategies;
    /** 진행중 과제 비중이 기준 이상인 전략(없으면 null) */
    private String dominantStrategy;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StrategyShare {
        private String strategy;
        private boolean deprecated;
        private long projects;
        private long activeProjects;
        private long proposals;
        private long approvals;
        private BigDecimal activeShare;
    }
}
