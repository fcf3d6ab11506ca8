package com.axcockpit.backend.ingest;

import com.axcockpit.backend.error.CockpitException;
import com.axcockpit.backend.error.ErrorKind;
import com.axcockpit.backend.ingest.excel.ParsedSnapshot;
import com.axcockpit.backend.ingest.excel.SnapshotParser;
import com.axcockpit.backend.ingest.excel.WorkbookData;
import com.axcockpit.backend.ingest.excel.WorkbookReader;
import com.axcockpit.backend.reconcile.ReconcileStats;
import com.axcockpit.backend.repo.SnapshotRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.io.InputStream;
import java.time.LocalDate;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 스냅샷 적재 진입점: 읽기 → 파싱 → (트랜잭션) 검증/반영.
 * 규칙 위반은 예외 대신 실패 리포트로 돌려준다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SnapshotIngestService {

    private final WorkbookReader reader;
    private final SnapshotParser parser;
    private final SnapshotCommitter committer;
    private final SnapshotRepository snapshotRepository;

    // 같은 날짜 동시 적재 차단
    private final Set<LocalDate> inFlight = ConcurrentHashMap.newKeySet();

    // 날짜가 달라도 같은 새 전략/과제를 만들면 유니크 키에서 부딪히므로 반영은 한 번에 하나씩
    private final ReentrantLock commitLock = new ReentrantLock();

    /** 파일명(YYYY-MM-DD.xlsx)에서 스냅샷 날짜를 얻는다 */
    public IngestReport ingest(InputStream in, String filename, String actor) {
        LocalDate date;
        try {
            date = SnapshotFileName.parse(filename);
        } catch (CockpitException e) {
            log.warn("[ingest] rejected {}: {}", filename, e.toString());
            return IngestReport.failure(null, filename, e);
        }
        return ingest(in, date, filename, actor);
    }

    public IngestReport ingest(InputStream in, LocalDate snapshotDate, String filename, String actor) {
        if (!inFlight.add(snapshotDate)) {
            CockpitException e = SnapshotValidator.duplicate(snapshotDate);
            log.warn("[ingest] {} is already being ingested", snapshotDate);
            return IngestReport.failure(snapshotDate, filename, e);
        }
        long started = System.currentTimeMillis();
        try {
            log.info("[ingest] start snapshot={} file={} actor={}", snapshotDate, filename, actor);
            WorkbookData workbook = reader.read(in);
            ParsedSnapshot parsed = parser.parse(workbook, snapshotDate);
            ReconcileStats stats = commitSerialized(parsed, filename, actor);

            IngestReport report = IngestReport.success(parsed, filename, stats);
            log.info("[ingest] done snapshot={} accepted={} rejected={} events={} in {}ms",
                    snapshotDate, report.getAcceptedRows(), report.getRejectedRows(),
                    report.getEventsWritten(), System.currentTimeMillis() - started);
            return report;
        } catch (CockpitException e) {
            log.warn("[ingest] failed snapshot={}: {}", snapshotDate, e.toString());
            return IngestReport.failure(snapshotDate, filename, e);
        } catch (DataIntegrityViolationException e) {
            // 다른 인스턴스가 먼저 같은 날짜를 커밋한 경우
            if (snapshotRepository.existsBySnapshotDate(snapshotDate)) {
                log.warn("[ingest] lost race for snapshot={}", snapshotDate);
                return IngestReport.failure(snapshotDate, filename, SnapshotValidator.duplicate(snapshotDate));
            }
            log.warn("[ingest] failed snapshot={}: {}", snapshotDate, e.getMostSpecificCause().toString());
            return IngestReport.failure(snapshotDate, filename, new CockpitException(ErrorKind.CONSTRAINT_VIOLATION,
                    "Store constraint violated while committing snapshot " + snapshotDate, e));
        } finally {
            inFlight.remove(snapshotDate);
        }
    }

    private ReconcileStats commitSerialized(ParsedSnapshot parsed, String filename, String actor) {
        commitLock.lock();
        try {
            try {
                return committer.commit(parsed, filename, actor);
            } catch (DataIntegrityViolationException e) {
                // 다른 인스턴스가 같은 전략/과제를 먼저 커밋한 경우: 커밋된 행을 다시 읽고 한 번만 재시도
                log.warn("[ingest] constraint conflict on snapshot={}, retrying once", parsed.snapshotDate());
                return committer.commit(parsed, filename, actor);
            }
        } finally {
            commitLock.unlock();
        }
    }
}
