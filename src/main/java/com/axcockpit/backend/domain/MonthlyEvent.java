package com.axcockpit.backend.domain;

import jakarta.persistence.*;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * (과제, 월, 구분) 당 최대 1건. 같은 월을 담은 이후 스냅샷이 count 를 덮어쓴다(latest-snapshot-wins).
 */
@Entity
@Table(name = "monthly_event",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_monthly_event_project_month_kind",
                        columnNames = {"project_id", "month_key", "kind"})
        },
        indexes = {
                @Index(name = "idx_monthly_event_month", columnList = "month_key")
        }
)
public class MonthlyEvent {

    public enum Kind {
        /** 신규 제안 */
        PROPOSAL,
        /** 승인 */
        APPROVAL
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "project_id", nullable = false)
    private Project project;

    /** YYYY-MM */
    @Column(name = "month_key", nullable = false, length = 7)
    private String monthKey;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Kind kind;

    @Column(name = "event_count", nullable = false)
    private long count;

    /** 이 값을 마지막으로 기록한 스냅샷 날짜 */
    @Column(name = "source_snapshot_date", nullable = false)
    private LocalDate sourceSnapshotDate;

    /** 값이 같아도 마지막으로 이 키를 담은 스냅샷 날짜. 감사 대상 아님 */
    @Column(name = "confirmed_snapshot_date", nullable = false)
    private LocalDate confirmedSnapshotDate;

    @Column(name = "note", length = 1000)
    private String note;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt = LocalDateTime.now();

    protected MonthlyEvent() {}

    public MonthlyEvent(Project project, String monthKey, Kind kind) {
        this.project = project;
        this.monthKey = monthKey;
        this.kind = kind;
    }

    @PreUpdate
    public void onUpdate() {
        this.updatedAt = LocalDateTime.now();
    }

    /** 감사 로그/엔티티 id 용 키: "P001|2026-02|PROPOSAL" */
    public String key() {
        return keyOf(project.getCode(), monthKey, kind);
    }

    public static String keyOf(String projectCode, String monthKey, Kind kind) {
        return projectCode + "|" + monthKey + "|" + kind.name();
    }

    public Map<String, Object> toAuditState() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("project", project.getCode());
        m.put("monthKey", monthKey);
        m.put("kind", kind.name());
        m.put("count", count);
        m.put("sourceSnapshotDate", Objects.toString(sourceSnapshotDate, null));
        m.put("note", note);
        return m;
    }

    // ====== getters / setters ======

    public Long getId() { return id; }

    public Project getProject() { return project; }

    public String getMonthKey() { return monthKey; }

    public Kind getKind() { return kind; }

    public long getCount() { return count; }
    public void setCount(long count) { this.count = count; }

    public LocalDate getSourceSnapshotDate() { return sourceSnapshotDate; }
    public void setSourceSnapshotDate(LocalDate sourceSnapshotDate) { this.sourceSnapshotDate = sourceSnapshotDate; }

    public LocalDate getConfirmedSnapshotDate() { return confirmedSnapshotDate; }
    public void setConfirmedSnapshotDate(LocalDate confirmedSnapshotDate) { this.confirmedSnapshotDate = confirmedSnapshotDate; }

    public String getNote() { return note; }
    public void setNote(String note) { this.note = note; }

    public LocalDateTime getUpdatedAt() { return updatedAt; }
}
