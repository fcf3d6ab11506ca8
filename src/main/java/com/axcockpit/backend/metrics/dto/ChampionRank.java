package com.axcockpit.backend.metrics.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChampionRank {
    private int rank;
    private String champion;
    private long proposals;
    private long approvals;
    private long activeProjects;
}
