package com.axcockpit.backend.domain;

import com.axcockpit.backend.audit.AuditEntityType;
import com.axcockpit.backend.audit.ChangeKind;
import jakarta.persistence.*;

import java.time.Instant;
import java.time.LocalDate;

@Entity
@Table(name = "audit_log",
        indexes = {
                @Index(name = "idx_audit_entity", columnList = "entity_type, entity_id")
        })
public class AuditLog {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "entity_type", nullable = false, length = 32)
    private AuditEntityType entityType;

    @Column(name = "entity_id", nullable = false, length = 200)
    private String entityId;

    @Enumerated(EnumType.STRING)
    @Column(name = "change_kind", nullable = false, length = 16)
    private ChangeKind changeKind; // CREATE, UPDATE, DELETE

    /** 콤마 구분 변경 필드명 (UPDATE 만) */
    @Column(name = "changed_fields", length = 500)
    private String changedFields;

    @Lob
    @Column(name = "before_json")
    private String beforeJson;

    @Lob
    @Column(name = "after_json")
    private String afterJson;

    @Column(nullable = false, length = 100)
    private String actor;

    @Column(name = "snapshot_date")
    private LocalDate snapshotDate;

    @Column(name = "recorded_at", nullable = false)
    private Instant recordedAt;

    // --- getters/setters ---
    public Long getId() { return id; }

    public AuditEntityType getEntityType() { return entityType; }
    public void setEntityType(AuditEntityType entityType) { this.entityType = entityType; }

    public String getEntityId() { return entityId; }
    public void setEntityId(String entityId) { this.entityId = entityId; }

    public ChangeKind getChangeKind() { return changeKind; }
    public void setChangeKind(ChangeKind changeKind) { this.changeKind = changeKind; }

    public String getChangedFields() { return changedFields; }
    public void setChangedFields(String changedFields) { this.changedFields = changedFields; }

    public String getBeforeJson() { return beforeJson; }
    public void setBeforeJson(String beforeJson) { this.beforeJson = beforeJson; }

    public String getAfterJson() { return afterJson; }
    public void setAfterJson(String afterJson) { this.afterJson = afterJson; }

    public String getActor() { return actor; }
    public void setActor(String actor) { this.actor = actor; }

    public LocalDate getSnapshotDate() { return snapshotDate; }
    public void setSnapshotDate(LocalDate snapshotDate) { this.snapshotDate = snapshotDate; }

    public Instant getRecordedAt() { return recordedAt; }
    public void setRecordedAt(Instant recordedAt) { this.recordedAt = recordedAt; }
}
