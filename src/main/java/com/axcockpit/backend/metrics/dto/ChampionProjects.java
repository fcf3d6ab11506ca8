package com.axcockpit.backend.metrics.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/** 챔피언 1명과 담당 과제 목록(과제명 오름차순) */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChampionProjects {
    private String champion;
    private List<ProjectRow> projects;
}
