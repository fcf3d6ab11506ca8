package com.axcockpit.backend.domain;

import jakarta.persistence.*;

import java.time.Instant;
import java.time.LocalDate;

/**
 * MonthlyEvent 값 변경 이력(append-only). 특정 스냅샷 날짜 기준 지표를 재구성할 때 사용한다.
 */
@Entity
@Table(name = "monthly_event_revision",
        indexes = {
                @Index(name = "idx_revision_key", columnList = "project_code, month_key, kind"),
                @Index(name = "idx_revision_snapshot", columnList = "snapshot_date")
        })
public class MonthlyEventRevision {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "project_code", nullable = false, updatable = false, length = 64)
    private String projectCode;

    @Column(name = "month_key", nullable = false, updatable = false, length = 7)
    private String monthKey;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 16)
    private MonthlyEvent.Kind kind;

    @Column(name = "event_count", nullable = false, updatable = false)
    private long count;

    @Column(name = "snapshot_date", nullable = false, updatable = false)
    private LocalDate snapshotDate;

    @Column(nullable = false, updatable = false)
    private Instant recordedAt = Instant.now();

    protected MonthlyEventRevision() {}

    public MonthlyEventRevision(String projectCode, String monthKey, MonthlyEvent.Kind kind,
                                long count, LocalDate snapshotDate) {
        this.projectCode = projectCode;
        this.monthKey = monthKey;
        this.kind = kind;
        this.count = count;
        this.snapshotDate = snapshotDate;
    }

    public static MonthlyEventRevision of(MonthlyEvent event) {
        return new MonthlyEventRevision(event.getProject().getCode(), event.getMonthKey(), event.getKind(),
                event.getCount(), event.getSourceSnapshotDate());
    }

    // --- getters ---
    public Long getId() { return id; }
    public String getProjectCode() { return projectCode; }
    public String getMonthKey() { return monthKey; }
    public MonthlyEvent.Kind getKind() { return kind; }
    public long getCount() { return count; }
    public LocalDate getSnapshotDate() { return snapshotDate; }
    public Instant getRecordedAt() { return recordedAt; }
}
