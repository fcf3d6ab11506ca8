package com.axcockpit.backend.domain;

import jakarta.persistence.*;

import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 스냅샷 적재 원장. 한 번 생성되면 수정/삭제하지 않는다.
 */
@Entity
@Table(name = "snapshot",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_snapshot_date", columnNames = {"snapshot_date"})
        })
public class Snapshot {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "snapshot_date", nullable = false, updatable = false)
    private LocalDate snapshotDate;

    @Column(name = "ingested_at", nullable = false, updatable = false)
    private Instant ingestedAt = Instant.now();

    @Column(name = "source_filename", updatable = false)
    private String sourceFilename;

    @Column(name = "accepted_rows", nullable = false, updatable = false)
    private int acceptedRows;

    @Column(name = "rejected_rows", nullable = false, updatable = false)
    private int rejectedRows;

    protected Snapshot() {}

    public Snapshot(LocalDate snapshotDate, String sourceFilename, int acceptedRows, int rejectedRows) {
        this.snapshotDate = snapshotDate;
        this.sourceFilename = sourceFilename;
        this.acceptedRows = acceptedRows;
        this.rejectedRows = rejectedRows;
    }

    public Map<String, Object> toAuditState() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("snapshotDate", snapshotDate.toString());
        m.put("sourceFilename", sourceFilename);
        m.put("acceptedRows", acceptedRows);
        m.put("rejectedRows", rejectedRows);
        return m;
    }

    // --- getters ---
    public Long getId() { return id; }
    public LocalDate getSnapshotDate() { return snapshotDate; }
    public Instant getIngestedAt() { return ingestedAt; }
    public String getSourceFilename() { return sourceFilename; }
    public int getAcceptedRows() { return acceptedRows; }
    public int getRejectedRows() { return rejectedRows; }
}
