package com.axcockpit.backend.metrics.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DashboardMetrics {
    private String fromMonth;
    private String toMonth;
    private LocalDate asOf;

    private KpiSummary kpis;
    private List<ChampionRank> rankings;
    private StrategyDistribution distribution;
    private ActivityHeatmap heatmap;
    private List<MonthlyTrend> trend;
    private List<StatusCount> statuses;
    private List<String> warnings;
}
