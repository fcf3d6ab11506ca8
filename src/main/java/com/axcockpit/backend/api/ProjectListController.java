package com.axcockpit.backend.api;

import com.axcockpit.backend.config.CockpitProps;
import com.axcockpit.backend.metrics.ProjectListService;
import com.axcockpit.backend.metrics.dto.ChampionProjects;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequiredArgsConstructor
public class ProjectListController {

    private final ProjectListService projectListService;
    private final CockpitProps props;

    /** status 를 생략하면 첫 번째 진행중 상태, 빈 값(status=)이면 전체 */
    @GetMapping("/api/projects")
    public List<ChampionProjects> projects(@RequestParam(required = false) String champion,
                                           @RequestParam(required = false) String strategy,
                                           @RequestParam(required = false) String status) {
        if (status == null) {
            List<String> active = props.getMetrics().getActiveStatuses();
            status = active.isEmpty() ? null : active.get(0);
        }
        return projectListService.listByChampion(champion, strategy, status);
    }
}
