package com.axcockpit.backend.ingest;

import com.axcockpit.backend.error.CockpitException;
import com.axcockpit.backend.error.ErrorKind;
import com.axcockpit.backend.ingest.excel.MasterRow;
import com.axcockpit.backend.ingest.excel.MonthlyRow;
import com.axcockpit.backend.ingest.excel.ParsedSnapshot;
import com.axcockpit.backend.repo.SnapshotRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 같은 날짜 스냅샷 재적재 차단 + 반영 직전 제약 확인
 */
@Component
@RequiredArgsConstructor
public class SnapshotValidator {

    private final SnapshotRepository snapshotRepository;

    public void requireNotIngested(LocalDate snapshotDate) {
        if (snapshotRepository.existsBySnapshotDate(snapshotDate)) {
            throw duplicate(snapshotDate);
        }
    }

    /** 파서가 보장하는 조건을 반영 직전에 한 번 더 확인한다(파서 외 경로로 만든 ParsedSnapshot 대비) */
    public void validate(ParsedSnapshot parsed) {
        Set<String> codes = parsed.projects().stream().map(MasterRow::code).collect(Collectors.toSet());
        for (Map.Entry<String, List<MonthlyRow>> e : parsed.monthly().entrySet()) {
            for (MonthlyRow r : e.getValue()) {
                if (!codes.contains(r.projectCode())) {
                    throw CockpitException.atRow(ErrorKind.ORPHAN_MONTHLY_ROW, e.getKey(), r.rowNumber(),
                            "Project ID " + r.projectCode() + " not found in master sheet");
                }
                if (r.proposals() < 0 || r.approvals() < 0) {
                    throw CockpitException.atRow(ErrorKind.INVALID_EVENT_COUNT, e.getKey(), r.rowNumber(),
                            "Negative count for " + r.projectCode());
                }
            }
        }
    }

    public static CockpitException duplicate(LocalDate snapshotDate) {
        return new CockpitException(ErrorKind.DUPLICATE_SNAPSHOT,
                "Snapshot for " + snapshotDate + " already ingested");
    }
}
