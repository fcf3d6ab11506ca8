package com.axcockpit.backend.ingest.excel;

import com.axcockpit.backend.config.CockpitProps;
import com.axcockpit.backend.error.CockpitException;
import com.axcockpit.backend.error.ErrorKind;
import com.axcockpit.backend.ingest.TestWorkbook;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotParserTest {

    private static final LocalDate DATE = LocalDate.of(2026, 3, 1);

    private final WorkbookReader reader = new WorkbookReader();
    private final SnapshotParser parser = new SnapshotParser(new CockpitProps());

    private ParsedSnapshot parse(TestWorkbook wb) {
        return parser.parse(reader.read(wb.stream()), DATE);
    }

    private static TestWorkbook twoProjects() {
        return TestWorkbook.create()
                .sheet("AX_Master", "과제ID", "과제명", "Champion", "전략분류", "심의상태", "수행 부서", "제안월")
                .row("P001", "Alpha", "Kim", "Growth", "승인(진행중)", "AX팀", LocalDate.of(2026, 1, 10))
                .row("P002", "Beta", "Lee", "Efficiency", "검토중");
    }

    @Test
    @DisplayName("마스터 + 월별 시트를 행 레코드로 변환")
    void parsesMasterAndMonthlySheets() {
        ParsedSnapshot parsed = parse(twoProjects()
                .month("2026-02")
                .row("P001", 3, 1, "첫 제안")
                .row("P002", null, true));

        assertEquals(DATE, parsed.snapshotDate());
        assertEquals(2, parsed.projects().size());
        MasterRow p1 = parsed.projects().get(0);
        assertEquals("P001", p1.code());
        assertEquals("AX팀", p1.orgUnit());
        assertEquals("2026-01", p1.proposedMonth());
        assertNull(p1.approvedMonth());

        List<MonthlyRow> feb = parsed.monthly().get("2026-02");
        assertEquals(2, feb.size());
        assertEquals(3L, feb.get(0).proposals());
        assertEquals(1L, feb.get(0).approvals());
        assertEquals("첫 제안", feb.get(0).note());
        assertEquals(0L, feb.get(1).proposals());
        assertEquals(1L, feb.get(1).approvals());

        assertEquals(4, parsed.acceptedRows());
        assertEquals(0, parsed.rejectedRows());
    }

    @Test
    void missingMasterSheet() {
        CockpitException e = assertThrows(CockpitException.class,
                () -> parse(TestWorkbook.create().month("2026-02").row("P001", 1, 0)));
        assertEquals(ErrorKind.MISSING_MASTER_SHEET, e.getKind());
    }

    @Test
    void missingRequiredMasterColumn() {
        CockpitException e = assertThrows(CockpitException.class, () -> parse(TestWorkbook.create()
                .sheet("AX_Master", "과제ID", "과제명", "Champion", "심의상태")
                .row("P001", "Alpha", "Kim", "승인(진행중)")));
        assertEquals(ErrorKind.MISSING_COLUMNS, e.getKind());
        assertTrue(e.getDetail().contains("전략분류"));
    }

    @Test
    @DisplayName("필수 필드가 빈 마스터 행은 시트/행 번호와 함께 실패")
    void blankRequiredField() {
        CockpitException e = assertThrows(CockpitException.class, () -> parse(twoProjects()
                .row("P003", "Gamma", null, "Growth", "검토중")));
        assertEquals(ErrorKind.INVALID_MASTER_ROW, e.getKind());
        assertEquals("AX_Master", e.getSheet());
        assertEquals(4, e.getRow());
    }

    @Test
    void duplicateProjectIdInMaster() {
        CockpitException e = assertThrows(CockpitException.class, () -> parse(twoProjects()
                .row("P001", "Alpha again", "Kim", "Growth", "검토중")));
        assertEquals(ErrorKind.INVALID_MASTER_ROW, e.getKind());
        assertEquals(4, e.getRow());
    }

    @Test
    void orphanMonthlyRow() {
        CockpitException e = assertThrows(CockpitException.class, () -> parse(twoProjects()
                .month("2026-02")
                .row("P001", 1, 0)
                .row("P999", 1, 0)));
        assertEquals(ErrorKind.ORPHAN_MONTHLY_ROW, e.getKind());
        assertEquals("2026-02", e.getSheet());
        assertEquals(3, e.getRow());
    }

    @Test
    void negativeCountFailsSnapshot() {
        CockpitException e = assertThrows(CockpitException.class, () -> parse(twoProjects()
                .month("2026-02")
                .row("P001", -2, 0)));
        assertEquals(ErrorKind.INVALID_EVENT_COUNT, e.getKind());
    }

    @Test
    @DisplayName("이름이 YYYY-MM 이 아닌 시트는 경고만 남기고 무시")
    void ignoresNonMonthSheets() {
        ParsedSnapshot parsed = parse(twoProjects()
                .sheet("Summary", "foo")
                .row("bar")
                .sheet("2026-13", "과제ID", "신규제안여부", "승인여부")
                .row("P001", 1, 1));

        assertTrue(parsed.monthly().isEmpty());
        assertEquals(2, parsed.warnings().size());
        assertTrue(parsed.warnings().get(0).contains("Summary"));
    }

    @Test
    void blankProjectIdRowIsRejectedWithWarning() {
        ParsedSnapshot parsed = parse(twoProjects()
                .month("2026-02")
                .row(null, 1, 0, "누락")
                .row("P001", 2, 0));

        assertEquals(1, parsed.rejectedRows());
        assertEquals(1, parsed.monthlyRowCount());
        assertEquals(1, parsed.warnings().size());
    }

    @Test
    @DisplayName("같은 시트의 같은 과제 행은 합산")
    void duplicateMonthlyRowsAreSummed() {
        ParsedSnapshot parsed = parse(twoProjects()
                .month("2026-02")
                .row("P001", 1, 0, "a")
                .row("P001", 2, 1, "b"));

        List<MonthlyRow> feb = parsed.monthly().get("2026-02");
        assertEquals(1, feb.size());
        assertEquals(3L, feb.get(0).proposals());
        assertEquals(1L, feb.get(0).approvals());
        assertEquals("a; b", feb.get(0).note());
        assertEquals(2, feb.get(0).rowNumber());
    }

    @Test
    void monthlySheetMissingCountColumn() {
        CockpitException e = assertThrows(CockpitException.class, () -> parse(twoProjects()
                .sheet("2026-02", "과제ID", "신규제안여부")
                .row("P001", 1)));
        assertEquals(ErrorKind.MISSING_COLUMNS, e.getKind());
        assertEquals("2026-02", e.getSheet());
    }
}
