package com.axcockpit.backend.ingest;

import com.axcockpit.backend.error.ErrorKind;
import com.axcockpit.backend.ingest.excel.ParsedSnapshot;
import com.axcockpit.backend.ingest.excel.SnapshotParser;
import com.axcockpit.backend.ingest.excel.WorkbookData;
import com.axcockpit.backend.ingest.excel.WorkbookReader;
import com.axcockpit.backend.reconcile.ReconcileStats;
import com.axcockpit.backend.repo.SnapshotRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.io.ByteArrayInputStream;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SnapshotIngestServiceTest {

    private static final LocalDate DATE = LocalDate.of(2026, 2, 1);

    @Mock WorkbookReader reader;
    @Mock SnapshotParser parser;
    @Mock SnapshotCommitter committer;
    @Mock SnapshotRepository snapshotRepository;

    @InjectMocks SnapshotIngestService ingestService;

    private final ParsedSnapshot parsed = new ParsedSnapshot(DATE, List.of(), Map.of(), 0, 0, List.of());

    @BeforeEach
    void stubParsing() {
        when(reader.read(any())).thenReturn(new WorkbookData(List.of()));
        when(parser.parse(any(), eq(DATE))).thenReturn(parsed);
    }

    @Test
    void constraintConflictIsRetriedOnce() {
        when(committer.commit(parsed, "2026-02-01.xlsx", "tester"))
                .thenThrow(new DataIntegrityViolationException("uk_strategy_name_key"))
                .thenReturn(new ReconcileStats(0, 1, 0, 0, 0));

        IngestReport report = ingestService.ingest(new ByteArrayInputStream(new byte[0]), "2026-02-01.xlsx", "tester");

        assertTrue(report.isSuccess());
        assertEquals(1, report.getProjectsUpdated());
        verify(committer, times(2)).commit(parsed, "2026-02-01.xlsx", "tester");
    }

    @Test
    void repeatedConstraintConflictBecomesFailedReport() {
        when(committer.commit(any(), any(), any()))
                .thenThrow(new DataIntegrityViolationException("uk_project_code"));
        when(snapshotRepository.existsBySnapshotDate(DATE)).thenReturn(false);

        IngestReport report = ingestService.ingest(new ByteArrayInputStream(new byte[0]), "2026-02-01.xlsx", "tester");

        assertFalse(report.isSuccess());
        assertEquals(ErrorKind.CONSTRAINT_VIOLATION, report.getError().getKind());
        verify(committer, times(2)).commit(any(), any(), any());
    }

    @Test
    void conflictOnCommittedDateIsDuplicate() {
        when(committer.commit(any(), any(), any()))
                .thenThrow(new DataIntegrityViolationException("uk_snapshot_date"));
        when(snapshotRepository.existsBySnapshotDate(DATE)).thenReturn(true);

        IngestReport report = ingestService.ingest(new ByteArrayInputStream(new byte[0]), "2026-02-01.xlsx", "tester");

        assertEquals(ErrorKind.DUPLICATE_SNAPSHOT, report.getError().getKind());
    }
}
