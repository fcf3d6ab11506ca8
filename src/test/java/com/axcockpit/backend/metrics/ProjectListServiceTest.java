package com.axcockpit.backend.metrics;

import com.axcockpit.backend.StoreTestSupport;
import com.axcockpit.backend.ingest.TestWorkbook;
import com.axcockpit.backend.metrics.dto.ChampionProjects;
import com.axcockpit.backend.metrics.dto.ProjectRow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProjectListServiceTest extends StoreTestSupport {

    private static final String ACTIVE = "승인(진행중)";

    @Autowired
    ProjectListService projectListService;

    @BeforeEach
    void seed() {
        assertTrue(ingest("2026-02-01.xlsx", TestWorkbook.create()
                .master()
                .row("P001", "Zeta", "Kim", "Growth", ACTIVE)
                .row("P002", "Alpha", "Kim", "Efficiency", ACTIVE)
                .row("P003", "Beta", "Lee", "Growth", "검토중")
                .row("P004", "Gamma", "Choi", "growth", ACTIVE)).isSuccess());
    }

    @Test
    @DisplayName("챔피언 이름순으로 묶고 그 안은 과제명 순")
    void groupsByChampion() {
        List<ChampionProjects> groups = projectListService.listByChampion(null, null, ACTIVE);

        assertEquals(List.of("Choi", "Kim"), groups.stream().map(ChampionProjects::getChampion).toList());
        assertEquals(List.of("Alpha", "Zeta"),
                groups.get(1).getProjects().stream().map(ProjectRow::getName).toList());
    }

    @Test
    void strategyFilterIgnoresCase() {
        List<ChampionProjects> groups = projectListService.listByChampion(null, " GROWTH ", null);

        assertEquals(3, groups.stream().mapToInt(g -> g.getProjects().size()).sum());
        assertTrue(groups.stream().flatMap(g -> g.getProjects().stream())
                .allMatch(r -> r.getStrategy().equals("Growth")));
    }

    @Test
    void championAndStatusFilters() {
        List<ChampionProjects> groups = projectListService.listByChampion("Lee", null, "검토중");

        assertEquals(1, groups.size());
        assertEquals("P003", groups.get(0).getProjects().get(0).getCode());
        assertTrue(projectListService.listByChampion("Lee", null, ACTIVE).isEmpty());
    }
}
