package com.axcockpit.backend.audit;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * 변경 1건. before 는 CREATE 에서, after 는 DELETE 에서 null.
 * snapshotDate 는 스냅샷 적재 중 발생한 변경일 때만 채운다.
 */
public record AuditRecord(AuditEntityType entityType,
                          String entityId,
                          ChangeKind changeKind,
                          Map<String, Object> before,
                          Map<String, Object> after,
                          String actor,
                          Instant timestamp,
                          LocalDate snapshotDate) {

    public static AuditRecord created(AuditEntityType type, String id, Map<String, Object> after,
                                      String actor, LocalDate snapshotDate) {
        return new AuditRecord(type, id, ChangeKind.CREATE, null, after, actor, Instant.now(), snapshotDate);
    }

    public static AuditRecord updated(AuditEntityType type, String id, Map<String, Object> before,
                                      Map<String, Object> after, String actor, LocalDate snapshotDate) {
        return new AuditRecord(type, id, ChangeKind.UPDATE, before, after, actor, Instant.now(), snapshotDate);
    }

    public static AuditRecord deleted(AuditEntityType type, String id, Map<String, Object> before, String actor) {
        return new AuditRecord(type, id, ChangeKind.DELETE, before, null, actor, Instant.now(), null);
    }

    /** before/after 에서 값이 달라진 필드명(정렬) */
    public TreeSet<String> changedFields() {
        TreeSet<String> fields = new TreeSet<>();
        if (before == null || after == null) return fields;
        for (String k : after.keySet()) {
            if (!Objects.equals(before.get(k), after.get(k))) fields.add(k);
        }
        for (String k : before.keySet()) {
            if (!after.containsKey(k)) fields.add(k);
        }
        return fields;
    }
}
