package com.axcockpit.backend.audit;

import com.axcockpit.backend.domain.AuditLog;
import com.axcockpit.backend.repo.AuditLogRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;

/**
 * audit_log 테이블에 저장하는 기본 구현. 호출 트랜잭션에 참여하므로 변경이 롤백되면 로그도 함께 사라진다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaAuditRecorder implements AuditRecorder {

    private final AuditLogRepository auditLogRepository;
    private final ObjectMapper objectMapper;

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void record(AuditRecord entry) {
        AuditLog row = new AuditLog();
        row.setEntityType(entry.entityType());
        row.setEntityId(entry.entityId());
        row.setChangeKind(entry.changeKind());
        if (entry.changeKind() == ChangeKind.UPDATE) {
            row.setChangedFields(String.join(",", entry.changedFields()));
        }
        row.setBeforeJson(toJson(entry.before()));
        row.setAfterJson(toJson(entry.after()));
        row.setActor(entry.actor());
        row.setSnapshotDate(entry.snapshotDate());
        row.setRecordedAt(entry.timestamp());
        auditLogRepository.save(row);
        log.debug("[audit] {} {} {}", entry.changeKind(), entry.entityType(), entry.entityId());
    }

    private String toJson(Map<String, Object> state) {
        if (state == null) return null;
        try {
            return objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("audit state is not serializable: " + state, e);
        }
    }
}
