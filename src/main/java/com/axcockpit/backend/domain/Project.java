package com.axcockpit.backend.domain;

import jakarta.persistence.*;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

@Entity
@Table(name = "project",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_project_code", columnNames = {"code"})
        },
        indexes = {
                @Index(name = "ix_project_champion", columnList = "champion"),
                @Index(name = "ix_project_strategy", columnList = "strategy_id")
        })
public class Project {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** 과제ID. 생성 후 변경 불가 */
    @Column(name = "code", nullable = false, updatable = false, length = 64)
    private String code;

    @Column(nullable = false, length = 300)
    private String name;

    @Column(nullable = false, length = 100)
    private String champion;

    @ManyToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "strategy_id", nullable = false)
    private Strategy strategy;

    @Column(nullable = false, length = 50)
    private String status;

    @Column(name = "org_unit", length = 100)
    private String orgUnit;

    @Column(name = "proposed_month", length = 20)
    private String proposedMonth;

    @Column(name = "approved_month", length = 20)
    private String approvedMonth;

    @Column(name = "created_snapshot_date", nullable = false)
    private LocalDate createdSnapshotDate;

    @Column(name = "last_updated_snapshot_date", nullable = false)
    private LocalDate lastUpdatedSnapshotDate;

    /** 같은 값이라도 마지막으로 이 과제를 담은 스냅샷 날짜. 감사 대상 아님 */
    @Column(name = "confirmed_snapshot_date", nullable = false)
    private LocalDate confirmedSnapshotDate;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt = LocalDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt = LocalDateTime.now();

    protected Project() {}

    public Project(String code, LocalDate createdSnapshotDate) {
        this.code = code;
        this.createdSnapshotDate = createdSnapshotDate;
        this.lastUpdatedSnapshotDate = createdSnapshotDate;
        this.confirmedSnapshotDate = createdSnapshotDate;
    }

    @PreUpdate
    public void onUpdate() {
        this.updatedAt = LocalDateTime.now();
    }

    /** 감사 로그 before/after 용 상태. 타임스탬프는 flush 시점에 바뀌므로 제외 */
    public Map<String, Object> toAuditState() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("code", code);
        m.put("name", name);
        m.put("champion", champion);
        m.put("strategy", strategy == null ? null : strategy.getName());
        m.put("status", status);
        m.put("orgUnit", orgUnit);
        m.put("proposedMonth", proposedMonth);
        m.put("approvedMonth", approvedMonth);
        m.put("createdSnapshotDate", Objects.toString(createdSnapshotDate, null));
        m.put("lastUpdatedSnapshotDate", Objects.toString(lastUpdatedSnapshotDate, null));
        return m;
    }

    // ====== getters / setters ======

    public Long getId() { return id; }

    public String getCode() { return code; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getChampion() { return champion; }
    public void setChampion(String champion) { this.champion = champion; }

    public Strategy getStrategy() { return strategy; }
    public void setStrategy(Strategy strategy) { this.strategy = strategy; }

    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }

    public String getOrgUnit() { return orgUnit; }
    public void setOrgUnit(String orgUnit) { this.orgUnit = orgUnit; }

    public String getProposedMonth() { return proposedMonth; }
    public void setProposedMonth(String proposedMonth) { this.proposedMonth = proposedMonth; }

    public String getApprovedMonth() { return approvedMonth; }
    public void setApprovedMonth(String approvedMonth) { this.approvedMonth = approvedMonth; }

    public LocalDate getCreatedSnapshotDate() { return createdSnapshotDate; }
    public void setCreatedSnapshotDate(LocalDate createdSnapshotDate) { this.createdSnapshotDate = createdSnapshotDate; }

    public LocalDate getLastUpdatedSnapshotDate() { return lastUpdatedSnapshotDate; }
    public void setLastUpdatedSnapshotDate(LocalDate lastUpdatedSnapshotDate) { this.lastUpdatedSnapshotDate = lastUpdatedSnapshotDate; }

    public LocalDate getConfirmedSnapshotDate() { return confirmedSnapshotDate; }
    public void setConfirmedSnapshotDate(LocalDate confirmedSnapshotDate) { this.confirmedSnapshotDate = confirmedSnapshotDate; }

    public LocalDateTime getCreatedAt() { return createdAt; }

    public LocalDateTime getUpdatedAt() { return updatedAt; }

    // equals/hashCode: code 기준
    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Project that)) return false;
        return code != null && code.equals(that.code);
    }
    @Override public int hashCode() { return Objects.hash(code); }
}
