package com.axcockpit.backend.metrics;

import com.axcockpit.backend.domain.Project;
import com.axcockpit.backend.domain.Strategy;
import com.axcockpit.backend.metrics.dto.ChampionProjects;
import com.axcockpit.backend.metrics.dto.ProjectRow;
import com.axcockpit.backend.repo.ProjectRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * 챔피언별 과제 목록. 필터 값이 null/공백이면 해당 조건은 적용하지 않는다.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ProjectListService {

    private final ProjectRepository projectRepository;

    public List<ChampionProjects> listByChampion(String champion, String strategy, String status) {
        String strategyKey = isBlank(strategy) ? null : Strategy.keyOf(strategy);

        Map<String, List<ProjectRow>> grouped = projectRepository.findAllByOrderByCodeAsc().stream()
                .filter(p -> isBlank(champion) || p.getChampion().equals(champion.trim()))
                .filter(p -> strategyKey == null || p.getStrategy().getNameKey().equals(strategyKey))
                .filter(p -> isBlank(status) || p.getStatus().equals(status.trim()))
                .sorted(Comparator.comparing(Project::getName))
                .collect(Collectors.groupingBy(Project::getChampion, TreeMap::new,
                        Collectors.mapping(ProjectListService::toRow, Collectors.toList())));

        return grouped.entrySet().stream()
                .map(e -> new ChampionProjects(e.getKey(), e.getValue()))
                .toList();
    }

    private static ProjectRow toRow(Project p) {
        return new ProjectRow(p.getCode(), p.getName(), p.getStrategy().getName(), p.getStatus(), p.getOrgUnit());
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
