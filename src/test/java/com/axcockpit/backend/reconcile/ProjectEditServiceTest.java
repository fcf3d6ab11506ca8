package com.axcockpit.backend.reconcile;

import com.axcockpit.backend.StoreTestSupport;
import com.axcockpit.backend.audit.AuditEntityType;
import com.axcockpit.backend.audit.ChangeKind;
import com.axcockpit.backend.domain.AuditLog;
import com.axcockpit.backend.domain.MonthlyEvent;
import com.axcockpit.backend.domain.Project;
import com.axcockpit.backend.domain.Strategy;
import com.axcockpit.backend.error.CockpitException;
import com.axcockpit.backend.error.ErrorKind;
import com.axcockpit.backend.ingest.TestWorkbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProjectEditServiceTest extends StoreTestSupport {

    private static final LocalDate SNAPSHOT = LocalDate.of(2026, 3, 1);

    @Autowired
    ProjectEditService editService;

    @BeforeEach
    void seed() {
        assertTrue(ingest("2026-03-01.xlsx", TestWorkbook.create()
                .master()
                .row("P001", "Alpha", "Kim", "Growth", "승인(진행중)")
                .row("P002", "Beta", "Lee", "Growth", "검토중")
                .month("2026-02")
                .row("P001", 2, 0)).isSuccess());
    }

    @Test
    @DisplayName("직접 편집도 바뀐 필드만 감사 로그로 남기고 스냅샷 날짜는 건드리지 않는다")
    void updateProjectAuditsDiff() {
        Project p = editService.updateProject("P002",
                new ProjectFields(null, "Park", null, "승인(진행중)", null, null, null), "editor");

        assertEquals("Park", p.getChampion());
        assertEquals("Beta", p.getName());
        assertEquals(SNAPSHOT, p.getLastUpdatedSnapshotDate());

        List<AuditLog> trail = audit(AuditEntityType.PROJECT, "P002");
        AuditLog last = trail.get(trail.size() - 1);
        assertEquals(ChangeKind.UPDATE, last.getChangeKind());
        assertEquals("champion,status", last.getChangedFields());
        assertEquals("editor", last.getActor());
        assertNull(last.getSnapshotDate());
    }

    @Test
    void noOpEditWritesNoAudit() {
        long before = auditLogRepository.count();
        editService.updateProject("P001", new ProjectFields("Alpha", null, " growth ", null, null, null, null), "editor");
        assertEquals(before, auditLogRepository.count());
    }

    @Test
    void unknownProject() {
        CockpitException e = assertThrows(CockpitException.class, () -> editService.updateProject("P999",
                new ProjectFields("x", null, null, null, null, null, null), "editor"));
        assertEquals(ErrorKind.UNKNOWN_ENTITY, e.getKind());
    }

    @Test
    void blankRequiredFieldIsRejected() {
        CockpitException e = assertThrows(CockpitException.class, () -> editService.updateProject("P001",
                new ProjectFields(" ", null, null, null, null, null, null), "editor"));
        assertEquals(ErrorKind.CONSTRAINT_VIOLATION, e.getKind());
        assertEquals("Alpha", projectRepository.findByCode("P001").orElseThrow().getName());
    }

    @Test
    @DisplayName("월별 이벤트 편집은 업서트, 출처는 최신 스냅샷 날짜")
    void updateMonthlyEventUpserts() {
        MonthlyEvent created = editService.updateMonthlyEvent("P002", "2026-02", MonthlyEvent.Kind.APPROVAL, 4, "editor");
        assertEquals(4, created.getCount());
        assertEquals(SNAPSHOT, created.getSourceSnapshotDate());

        MonthlyEvent updated = editService.updateMonthlyEvent("P001", "2026-02", MonthlyEvent.Kind.PROPOSAL, 7, "editor");
        assertEquals(7, updated.getCount());

        List<AuditLog> trail = audit(AuditEntityType.MONTHLY_EVENT, "P001|2026-02|PROPOSAL");
        assertEquals(ChangeKind.UPDATE, trail.get(trail.size() - 1).getChangeKind());
        assertEquals("count", trail.get(trail.size() - 1).getChangedFields());
    }

    @Test
    void invalidEventEdits() {
        assertEquals(ErrorKind.INVALID_EVENT_COUNT, assertThrows(CockpitException.class, () ->
                editService.updateMonthlyEvent("P001", "2026-02", MonthlyEvent.Kind.PROPOSAL, -1, "editor")).getKind());
        assertEquals(ErrorKind.CONSTRAINT_VIOLATION, assertThrows(CockpitException.class, () ->
                editService.updateMonthlyEvent("P001", "2026-2", MonthlyEvent.Kind.PROPOSAL, 1, "editor")).getKind());
        assertEquals(ErrorKind.UNKNOWN_ENTITY, assertThrows(CockpitException.class, () ->
                editService.updateMonthlyEvent("P404", "2026-02", MonthlyEvent.Kind.PROPOSAL, 1, "editor")).getKind());
    }

    @Test
    @DisplayName("참조 중인 전략은 삭제 불가, deprecate 는 가능")
    void referencedStrategyCannotBeDeleted() {
        CockpitException e = assertThrows(CockpitException.class, () -> editService.deleteStrategy("growth", "editor"));
        assertEquals(ErrorKind.CONSTRAINT_VIOLATION, e.getKind());

        Strategy s = editService.deprecateStrategy("Growth", "editor");
        assertTrue(s.isDeprecated());
        assertEquals("deprecated", audit(AuditEntityType.STRATEGY, "Growth").get(1).getChangedFields());
    }

    @Test
    void strategyDescriptionIsAudited() {
        Strategy s = editService.describeStrategy(" GROWTH", "  신규 매출 확대  ", "editor");
        assertEquals("신규 매출 확대", s.getDescription());
        assertEquals("신규 매출 확대", strategyRepository.findByNameKey("growth").orElseThrow().getDescription());

        List<AuditLog> trail = audit(AuditEntityType.STRATEGY, "Growth");
        assertEquals("description", trail.get(trail.size() - 1).getChangedFields());

        long before = auditLogRepository.count();
        editService.describeStrategy("Growth", "신규 매출 확대", "editor");
        assertEquals(before, auditLogRepository.count());

        assertNull(editService.describeStrategy("Growth", " ", "editor").getDescription());
        assertEquals(ErrorKind.UNKNOWN_ENTITY, assertThrows(CockpitException.class,
                () -> editService.describeStrategy("Nope", "x", "editor")).getKind());
    }

    @Test
    void unreferencedStrategyCanBeDeleted() {
        editService.updateProject("P001", new ProjectFields(null, null, "Efficiency", null, null, null, null), "editor");
        editService.updateProject("P002", new ProjectFields(null, null, "Efficiency", null, null, null, null), "editor");

        editService.deleteStrategy("Growth", "editor");

        assertTrue(strategyRepository.findByNameKey("growth").isEmpty());
        List<AuditLog> trail = audit(AuditEntityType.STRATEGY, "Growth");
        assertEquals(ChangeKind.DELETE, trail.get(trail.size() - 1).getChangeKind());
        assertEquals(ErrorKind.UNKNOWN_ENTITY, assertThrows(CockpitException.class,
                () -> editService.deleteStrategy("Growth", "editor")).getKind());
    }
}
