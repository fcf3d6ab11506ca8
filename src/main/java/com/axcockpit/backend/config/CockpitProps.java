package com.axcockpit.backend.config;

import com.axcockpit.backend.metrics.HeatmapScaling;
import com.axcockpit.backend.metrics.RankingMetric;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * application.yml 의 axcockpit.* 바인딩
 *
 * 예)
 * axcockpit:
 *   ingest:
 *     master-sheet: AX_Master
 *     on-startup: false
 *     inbox-dir: ./inbox
 *   metrics:
 *     active-statuses: [ "승인(진행중)" ]
 *     ranking-primary: PROPOSALS
 *     heatmap-scaling: LINEAR
 *   audit:
 *     default-actor: admin
 */
@Configuration
@ConfigurationProperties(prefix = "axcockpit")
public class CockpitProps {

    private Ingest ingest = new Ingest();
    private Metrics metrics = new Metrics();
    private Audit audit = new Audit();

    // --- nested types ---
    public static class Ingest {
        private String masterSheet = "AX_Master";
        private MasterColumns masterColumns = new MasterColumns();
        private MonthlyColumns monthlyColumns = new MonthlyColumns();

        // 기동 시 inbox 디렉터리의 미적재 스냅샷 자동 적재
        private boolean onStartup = false;
        private String inboxDir;

        public String getMasterSheet() { return masterSheet; }
        public void setMasterSheet(String masterSheet) { this.masterSheet = masterSheet; }

        public MasterColumns getMasterColumns() { return masterColumns; }
        public void setMasterColumns(MasterColumns masterColumns) { this.masterColumns = masterColumns; }

        public MonthlyColumns getMonthlyColumns() { return monthlyColumns; }
        public void setMonthlyColumns(MonthlyColumns monthlyColumns) { this.monthlyColumns = monthlyColumns; }

        public boolean isOnStartup() { return onStartup; }
        public void setOnStartup(boolean onStartup) { this.onStartup = onStartup; }

        public String getInboxDir() { return inboxDir; }
        public void setInboxDir(String inboxDir) { this.inboxDir = inboxDir; }
    }

    /** AX_Master 시트 헤더명 */
    public static class MasterColumns {
        private String projectId = "과제ID";
        private String name = "과제명";
        private String champion = "Champion";
        private String strategy = "전략분류";
        private String status = "심의상태";
        // 이하 선택 컬럼
        private String orgUnit = "수행 부서";
        private String proposedMonth = "제안월";
        private String approvedMonth = "승인월";

        public String getProjectId() { return projectId; }
        public void setProjectId(String projectId) { this.projectId = projectId; }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getChampion() { return champion; }
        public void setChampion(String champion) { this.champion = champion; }

        public String getStrategy() { return strategy; }
        public void setStrategy(String strategy) { this.strategy = strategy; }

        public String getStatus() { return status; }
        public void setStatus(String status) { this.status = status; }

        public String getOrgUnit() { return orgUnit; }
        public void setOrgUnit(String orgUnit) { this.orgUnit = orgUnit; }

        public String getProposedMonth() { return proposedMonth; }
        public void setProposedMonth(String proposedMonth) { this.proposedMonth = proposedMonth; }

        public String getApprovedMonth() { return approvedMonth; }
        public void setApprovedMonth(String approvedMonth) { this.approvedMonth = approvedMonth; }

        public List<String> required() {
            return List.of(projectId, name, champion, strategy, status);
        }
    }

    /** YYYY-MM 월별 시트 헤더명 */
    public static class MonthlyColumns {
        private String projectId = "과제ID";
        private String proposals = "신규제안여부";
        private String approvals = "승인여부";
        private String note = "비고";

        public String getProjectId() { return projectId; }
        public void setProjectId(String projectId) { this.projectId = projectId; }

        public String getProposals() { return proposals; }
        public void setProposals(String proposals) { this.proposals = proposals; }

        public String getApprovals() { return approvals; }
        public void setApprovals(String approvals) { this.approvals = approvals; }

        public String getNote() { return note; }
        public void setNote(String note) { this.note = note; }

        public List<String> required() {
            return List.of(projectId, proposals, approvals);
        }
    }

    public static class Metrics {
        private List<String> activeStatuses = new ArrayList<>(List.of("승인(진행중)"));
        private RankingMetric rankingPrimary = RankingMetric.PROPOSALS;
        private HeatmapScaling heatmapScaling = HeatmapScaling.LINEAR;
        private double dominantShare = 0.5;

        public List<String> getActiveStatuses() { return activeStatuses; }
        public void setActiveStatuses(List<String> activeStatuses) { this.activeStatuses = activeStatuses; }

        public RankingMetric getRankingPrimary() { return rankingPrimary; }
        public void setRankingPrimary(RankingMetric rankingPrimary) { this.rankingPrimary = rankingPrimary; }

        public HeatmapScaling getHeatmapScaling() { return heatmapScaling; }
        public void setHeatmapScaling(HeatmapScaling heatmapScaling) { this.heatmapScaling = heatmapScaling; }

        public double getDominantShare() { return dominantShare; }
        public void setDominantShare(double dominantShare) { this.dominantShare = dominantShare; }
    }

    public static class Audit {
        private String defaultActor = "admin";

        public String getDefaultActor() { return defaultActor; }
        public void setDefaultActor(String defaultActor) { this.defaultActor = defaultActor; }
    }

    // --- getters/setters ---
    public Ingest getIngest() { return ingest; }
    public void setIngest(Ingest ingest) { this.ingest = ingest; }

    public Metrics getMetrics() { return metrics; }
    public void setMetrics(Metrics metrics) { this.metrics = metrics; }

    public Audit getAudit() { return audit; }
    public void setAudit(Audit audit) { this.audit = audit; }
}
