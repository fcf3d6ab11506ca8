package com.axcockpit.backend.ingest;

import com.axcockpit.backend.StoreTestSupport;
import com.axcockpit.backend.audit.AuditEntityType;
import com.axcockpit.backend.audit.AuditRecorder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.mock.mockito.SpyBean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doThrow;

class SnapshotIngestRollbackTest extends StoreTestSupport {

    @SpyBean
    AuditRecorder auditRecorder;

    @Test
    @DisplayName("반영 도중 실패하면 스냅샷/과제/전략/감사 로그 모두 롤백")
    void failureMidReconcileRollsBackEverything() {
        doThrow(new IllegalStateException("audit store down"))
                .when(auditRecorder).record(argThat(r -> r != null && r.entityType() == AuditEntityType.MONTHLY_EVENT));

        TestWorkbook wb = TestWorkbook.create()
                .master()
                .row("P001", "Alpha", "Kim", "Growth", "승인(진행중)")
                .month("2026-01")
                .row("P001", 2, 0);

        assertThrows(IllegalStateException.class, () -> ingest("2026-02-01.xlsx", wb));

        assertEquals(0, snapshotRepository.count());
        assertEquals(0, projectRepository.count());
        assertEquals(0, strategyRepository.count());
        assertEquals(0, eventRepository.count());
        assertEquals(0, revisionRepository.count());
        assertEquals(0, auditLogRepository.count());
    }
}
