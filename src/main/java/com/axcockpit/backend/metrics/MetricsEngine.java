package com.axcockpit.backend.metrics;

import com.axcockpit.backend.config.CockpitProps;
import com.axcockpit.backend.domain.MonthlyEvent;
import com.axcockpit.backend.domain.MonthlyEventRevision;
import com.axcockpit.backend.domain.Project;
import com.axcockpit.backend.domain.Strategy;
import com.axcockpit.backend.metrics.dto.*;
import com.axcockpit.backend.repo.MonthlyEventRepository;
import com.axcockpit.backend.repo.MonthlyEventRevisionRepository;
import com.axcockpit.backend.repo.ProjectRepository;
import com.axcockpit.backend.repo.StrategyRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 대시보드 집계. 정본 저장소를 읽기만 하며, 같은 상태/같은 구간이면 항상 같은 결과를 낸다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class MetricsEngine {

    private final ProjectRepository projectRepository;
    private final StrategyRepository strategyRepository;
    private final MonthlyEventRepository eventRepository;
    private final MonthlyEventRevisionRepository revisionRepository;
    private final CockpitProps props;

    /** 과제 코드 + 월 + 건수. 현재값이든 이력값이든 같은 형태로 집계한다 */
    private record Fact(String projectCode, String monthKey, MonthlyEvent.Kind kind, long count) {}

    public DashboardMetrics computeMetrics(MetricsWindow window) {
        CockpitProps.Metrics cfg = props.getMetrics();
        Set<String> activeStatuses = new HashSet<>(cfg.getActiveStatuses());

        List<Project> projects = loadProjects(window.asOf());
        Map<String, Project> byCode = projects.stream()
                .collect(Collectors.toMap(Project::getCode, Function.identity()));
        List<Fact> facts = loadFacts(window.asOf(), byCode.keySet());
        List<Fact> windowed = facts.stream().filter(f -> window.contains(f.monthKey())).toList();

        List<String> warnings = new ArrayList<>();
        KpiSummary kpis = kpis(projects, byCode, windowed, activeStatuses);
        List<ChampionRank> rankings = rankings(projects, byCode, windowed, activeStatuses, cfg.getRankingPrimary());
        StrategyDistribution distribution = distribution(projects, byCode, facts, activeStatuses,
                cfg.getDominantShare(), warnings);
        ActivityHeatmap heatmap = heatmap(projects, byCode, windowed, cfg.getHeatmapScaling());
        List<MonthlyTrend> trend = trend(windowed);
        List<StatusCount> statuses = statuses(projects);

        log.debug("[metrics] window={}..{} asOf={} projects={} facts={}",
                window.fromMonth(), window.toMonth(), window.asOf(), projects.size(), windowed.size());

        return DashboardMetrics.builder()
                .fromMonth(window.fromMonth())
                .toMonth(window.toMonth())
                .asOf(window.asOf())
                .kpis(kpis)
                .rankings(rankings)
                .distribution(distribution)
                .heatmap(heatmap)
                .trend(trend)
                .statuses(statuses)
                .warnings(List.copyOf(warnings))
                .build();
    }

    public List<String> availableMonths() {
        return eventRepository.findDistinctMonthKeys();
    }

    // ---------- load ----------

    private List<Project> loadProjects(LocalDate asOf) {
        List<Project> all = projectRepository.findAllByOrderByCodeAsc();
        if (asOf == null) return all;
        return all.stream()
                .filter(p -> !p.getCreatedSnapshotDate().isAfter(asOf))
                .toList();
    }

    private List<Fact> loadFacts(LocalDate asOf, Set<String> codes) {
        if (asOf == null) {
            return eventRepository.findAll().stream()
                    .filter(e -> codes.contains(e.getProject().getCode()))
                    .map(e -> new Fact(e.getProject().getCode(), e.getMonthKey(), e.getKind(), e.getCount()))
                    .toList();
        }
        // 오래된 순으로 덮어쓰면 키별 asOf 시점 최신값만 남는다
        Map<String, MonthlyEventRevision> latest = new LinkedHashMap<>();
        for (MonthlyEventRevision r : revisionRepository.findAllUpTo(asOf)) {
            latest.put(MonthlyEvent.keyOf(r.getProjectCode(), r.getMonthKey(), r.getKind()), r);
        }
        return latest.values().stream()
                .filter(r -> codes.contains(r.getProjectCode()))
                .map(r -> new Fact(r.getProjectCode(), r.getMonthKey(), r.getKind(), r.getCount()))
                .toList();
    }

    // ---------- aggregates ----------

    private KpiSummary kpis(List<Project> projects, Map<String, Project> byCode, List<Fact> windowed,
                            Set<String> activeStatuses) {
        long active = projects.stream().filter(p -> activeStatuses.contains(p.getStatus())).count();
        long proposals = sum(windowed, MonthlyEvent.Kind.PROPOSAL);
        long approvals = sum(windowed, MonthlyEvent.Kind.APPROVAL);

        long champions = projects.stream().map(Project::getChampion).distinct().count();
        long activeChampions = windowed.stream()
                .filter(f -> f.count() > 0)
                .map(f -> byCode.get(f.projectCode()).getChampion())
                .distinct()
                .count();

        return new KpiSummary(projects.size(), active, proposals, approvals,
                ratio(approvals, proposals), ratio(activeChampions, champions));
    }

    private List<ChampionRank> rankings(List<Project> projects, Map<String, Project> byCode, List<Fact> windowed,
                                        Set<String> activeStatuses, RankingMetric primary) {
        Map<String, long[]> totals = new TreeMap<>();
        for (Project p : projects) {
            long[] t = totals.computeIfAbsent(p.getChampion(), k -> new long[3]);
            if (activeStatuses.contains(p.getStatus())) t[2]++;
        }
        for (Fact f : windowed) {
            long[] t = totals.get(byCode.get(f.projectCode()).getChampion());
            t[f.kind() == MonthlyEvent.Kind.PROPOSAL ? 0 : 1] += f.count();
        }

        Comparator<ChampionRank> order = Comparator
                .comparingLong((ChampionRank r) -> metric(r, primary)).reversed()
                .thenComparing(Comparator.comparingLong((ChampionRank r) -> metric(r, primary.other())).reversed())
                .thenComparing(ChampionRank::getChampion);

        List<ChampionRank> rows = totals.entrySet().stream()
                .map(e -> new ChampionRank(0, e.getKey(), e.getValue()[0], e.getValue()[1], e.getValue()[2]))
                .sorted(order)
                .collect(Collectors.toList());
        for (int i = 0; i < rows.size(); i++) {
            rows.get(i).setRank(i + 1);
        }
        return rows;
    }

    private StrategyDistribution distribution(List<Project> projects, Map<String, Project> byCode, List<Fact> facts,
                                              Set<String> activeStatuses, double dominantShare,
                                              List<String> warnings) {
        // 이름 키 → [과제, 진행중, 제안, 승인]
        Map<String, long[]> totals = new TreeMap<>();
        Map<String, Strategy> strategies = new HashMap<>();
        for (Strategy s : strategyRepository.findAll()) {
            if (!s.isDeprecated()) {
                totals.put(s.getNameKey(), new long[4]);
            }
            strategies.put(s.getNameKey(), s);
        }
        for (Project p : projects) {
            Strategy s = p.getStrategy();
            strategies.putIfAbsent(s.getNameKey(), s);
            long[] t = totals.computeIfAbsent(s.getNameKey(), k -> new long[4]);
            t[0]++;
            if (activeStatuses.contains(p.getStatus())) t[1]++;
        }
        for (Fact f : facts) {
            long[] t = totals.get(byCode.get(f.projectCode()).getStrategy().getNameKey());
            t[f.kind() == MonthlyEvent.Kind.PROPOSAL ? 2 : 3] += f.count();
        }

        long totalActive = totals.values().stream().mapToLong(t -> t[1]).sum();
        List<StrategyDistribution.StrategyShare> shares = new ArrayList<>();
        String dominant = null;
        for (Map.Entry<String, long[]> e : totals.entrySet()) {
            Strategy s = strategies.get(e.getKey());
            long[] t = e.getValue();
            BigDecimal share = ratio(t[1], totalActive);
            shares.add(new StrategyDistribution.StrategyShare(s.getName(), s.isDeprecated(),
                    t[0], t[1], t[2], t[3], share));
            if (dominant == null && totalActive > 0 && (double) t[1] / totalActive >= dominantShare) {
                dominant = s.getName();
                warnings.add("Strategy '" + s.getName() + "' holds " + t[1] + " of " + totalActive
                        + " active projects");
            }
        }
        return new StrategyDistribution(shares, dominant);
    }

    private ActivityHeatmap heatmap(List<Project> projects, Map<String, Project> byCode, List<Fact> windowed,
                                    HeatmapScaling scaling) {
        List<String> champions = projects.stream().map(Project::getChampion).distinct().sorted().toList();
        List<String> months = windowed.stream().map(Fact::monthKey).distinct().sorted().toList();

        long[][] grid = new long[champions.size()][months.size()];
        for (Fact f : windowed) {
            int r = champions.indexOf(byCode.get(f.projectCode()).getChampion());
            int c = months.indexOf(f.monthKey());
            grid[r][c] += f.count();
        }

        long max = 0;
        for (long[] row : grid) {
            for (long v : row) max = Math.max(max, v);
        }

        List<List<Long>> values = new ArrayList<>(champions.size());
        List<List<Double>> intensity = new ArrayList<>(champions.size());
        for (long[] row : grid) {
            List<Long> vr = new ArrayList<>(row.length);
            List<Double> ir = new ArrayList<>(row.length);
            for (long v : row) {
                vr.add(v);
                ir.add(scale(v, max, scaling));
            }
            values.add(vr);
            intensity.add(ir);
        }
        return new ActivityHeatmap(champions, months, values, intensity, max);
    }

    private List<MonthlyTrend> trend(List<Fact> windowed) {
        Map<String, MonthlyTrend> byMonth = new TreeMap<>();
        for (Fact f : windowed) {
            MonthlyTrend t = byMonth.computeIfAbsent(f.monthKey(), m -> new MonthlyTrend(m, 0, 0));
            if (f.kind() == MonthlyEvent.Kind.PROPOSAL) t.setProposals(t.getProposals() + f.count());
            else t.setApprovals(t.getApprovals() + f.count());
        }
        return new ArrayList<>(byMonth.values());
    }

    private List<StatusCount> statuses(List<Project> projects) {
        return projects.stream()
                .collect(Collectors.groupingBy(Project::getStatus, Collectors.counting()))
                .entrySet().stream()
                .map(e -> new StatusCount(e.getKey(), e.getValue()))
                .sorted(Comparator.comparingLong(StatusCount::getCount).reversed()
                        .thenComparing(StatusCount::getStatus))
                .toList();
    }

    // ---------- helpers ----------

    static double scale(long value, long max, HeatmapScaling scaling) {
        if (max <= 0 || value <= 0) return 0.0;
        double r = (double) value / max;
        if (scaling == HeatmapScaling.QUARTILE) {
            return Math.ceil(r * 4) / 4.0;
        }
        return r;
    }

    private static long metric(ChampionRank r, RankingMetric m) {
        return m == RankingMetric.PROPOSALS ? r.getProposals() : r.getApprovals();
    }

    private static long sum(List<Fact> facts, MonthlyEvent.Kind kind) {
        return facts.stream().filter(f -> f.kind() == kind).mapToLong(Fact::count).sum();
    }

    private static BigDecimal ratio(long num, long den) {
        if (den == 0) return BigDecimal.ZERO.setScale(2);
        return BigDecimal.valueOf(num).divide(BigDecimal.valueOf(den), 2, RoundingMode.HALF_UP);
    }
}
