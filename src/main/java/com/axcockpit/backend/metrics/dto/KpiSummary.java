package com.axcockpit.backend.metrics.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class KpiSummary {
    private long totalProjects;
    private long activeProjects;
    private long proposals;
    private long approvals;
    /** approvals / proposals (소수 둘째 자리) */
    private BigDecimal approvalConversionRate;
    /** 구간 내 활동한 챔피언 / 과제가 있는 챔피언 */
    private BigDecimal championParticipationRate;
}
