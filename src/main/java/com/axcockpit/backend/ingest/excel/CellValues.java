package com.axcockpit.backend.ingest.excel;

import com.axcockpit.backend.error.CockpitException;
import com.axcockpit.backend.error.ErrorKind;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * 셀 원시값 → 타입 변환. 파서 경계에서만 사용한다.
 */
public final class CellValues {

    private static final DateTimeFormatter MONTH = DateTimeFormatter.ofPattern("yyyy-MM");

    private CellValues() {}

    /** 문자열화. 12.0 처럼 정수인 숫자는 "12" 로 */
    public static String text(Object raw) {
        if (raw == null) return null;
        if (raw instanceof Double d) {
            if (d == Math.rint(d) && !Double.isInfinite(d)) {
                return BigDecimal.valueOf(d).toBigInteger().toString();
            }
            return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
        }
        String s = raw.toString().trim();
        return s.isEmpty() ? null : s;
    }

    /** 제안월/승인월 처럼 날짜 셀로 들어올 수 있는 월 값 */
    public static String month(Object raw) {
        if (raw instanceof LocalDate d) return d.format(MONTH);
        return text(raw);
    }

    /**
     * 건수 변환. 빈 값 → 0, TRUE/FALSE → 1/0, 음이 아닌 정수(숫자 또는 숫자 문자열) → 값.
     * 음수/소수/숫자가 아닌 값은 0 으로 보정하지 않고 INVALID_EVENT_COUNT.
     */
    public static long count(Object raw, String sheet, int row, String column) {
        if (raw == null) return 0L;
        if (raw instanceof Boolean b) return b ? 1L : 0L;

        BigDecimal value;
        if (raw instanceof Double d) {
            value = BigDecimal.valueOf(d);
        } else {
            String s = raw.toString().trim().replace(",", "");
            if (s.isEmpty()) return 0L;
            try {
                value = new BigDecimal(s);
            } catch (NumberFormatException e) {
                throw CockpitException.atRow(ErrorKind.INVALID_EVENT_COUNT, sheet, row,
                        "Non-numeric " + column + " value '" + raw + "'");
            }
        }
        if (value.signum() < 0) {
            throw CockpitException.atRow(ErrorKind.INVALID_EVENT_COUNT, sheet, row,
                    "Negative " + column + " value " + value.toPlainString());
        }
        try {
            return value.stripTrailingZeros().longValueExact();
        } catch (ArithmeticException e) {
            throw CockpitException.atRow(ErrorKind.INVALID_EVENT_COUNT, sheet, row,
                    "Non-integer " + column + " value " + value.toPlainString());
        }
    }
}
