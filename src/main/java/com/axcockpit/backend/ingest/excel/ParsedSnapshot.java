package com.axcockpit.backend.ingest.excel;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * 파싱 결과. 아직 어떤 엔티티도 만들지 않은 순수 데이터.
 *
 * @param monthly      월 키(YYYY-MM) 오름차순
 * @param acceptedRows 마스터 행 + 월별 행(합산 전) 수
 * @param rejectedRows 과제ID 가 비어 건너뛴 월별 행 수
 */
public record ParsedSnapshot(LocalDate snapshotDate,
                             List<MasterRow> projects,
                             Map<String, List<MonthlyRow>> monthly,
                             int acceptedRows,
                             int rejectedRows,
                             List<String> warnings) {

    public int monthlyRowCount() {
        return monthly.values().stream().mapToInt(List::size).sum();
    }
}
