package com.axcockpit.backend.metrics;

import com.axcockpit.backend.error.CockpitException;
import com.axcockpit.backend.error.ErrorKind;
import com.axcockpit.backend.ingest.excel.SnapshotParser;

import java.time.LocalDate;

/**
 * 집계 구간. fromMonth/toMonth 는 YYYY-MM(양끝 포함, null 이면 열림),
 * asOf 가 있으면 해당 스냅샷 날짜 시점의 상태로 계산한다.
 */
public record MetricsWindow(String fromMonth, String toMonth, LocalDate asOf) {

    public MetricsWindow {
        checkMonth(fromMonth);
        checkMonth(toMonth);
        if (fromMonth != null && toMonth != null && fromMonth.compareTo(toMonth) > 0) {
            throw new CockpitException(ErrorKind.CONSTRAINT_VIOLATION,
                    "Window start " + fromMonth + " is after end " + toMonth);
        }
    }

    public static MetricsWindow latest() {
        return new MetricsWindow(null, null, null);
    }

    public static MetricsWindow single(String month) {
        return new MetricsWindow(month, month, null);
    }

    public static MetricsWindow range(String fromMonth, String toMonth) {
        return new MetricsWindow(fromMonth, toMonth, null);
    }

    public MetricsWindow asOf(LocalDate snapshotDate) {
        return new MetricsWindow(fromMonth, toMonth, snapshotDate);
    }

    public boolean contains(String monthKey) {
        // YYYY-MM 은 문자열 비교가 곧 시간 순서
        if (fromMonth != null && monthKey.compareTo(fromMonth) < 0) return false;
        return toMonth == null || monthKey.compareTo(toMonth) <= 0;
    }

    private static void checkMonth(String month) {
        if (month != null && !SnapshotParser.MONTH_SHEET_PATTERN.matcher(month).matches()) {
            throw new CockpitException(ErrorKind.CONSTRAINT_VIOLATION, "Month must be YYYY-MM: " + month);
        }
    }
}
