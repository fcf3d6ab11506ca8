package com.axcockpit.backend.error;

/**
 * 적재/편집 규칙 위반. kind 로 원인을 구분하고, 시트 단위 오류는 시트명과 행 번호(엑셀 기준 1부터)를 함께 싣는다.
 */
public class CockpitException extends RuntimeException {

    private final ErrorKind kind;
    private final String sheet;
    private final Integer row;

    public CockpitException(ErrorKind kind, String detail) {
        this(kind, detail, null, null);
    }

    public CockpitException(ErrorKind kind, String detail, String sheet, Integer row) {
        super(detail);
        this.kind = kind;
        this.sheet = sheet;
        this.row = row;
    }

    public CockpitException(ErrorKind kind, String detail, Throwable cause) {
        super(detail, cause);
        this.kind = kind;
        this.sheet = null;
        this.row = null;
    }

    public static CockpitException atRow(ErrorKind kind, String sheet, int row, String detail) {
        return new CockpitException(kind, detail, sheet, row);
    }

    public static CockpitException unknownEntity(String type, String id) {
        return new CockpitException(ErrorKind.UNKNOWN_ENTITY, type + " not found: " + id);
    }

    public ErrorKind getKind() { return kind; }
    public String getDetail() { return getMessage(); }
    public String getSheet() { return sheet; }
    public Integer getRow() { return row; }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(kind.name()).append(": ").append(getMessage());
        if (sheet != null) {
            sb.append(" [sheet=").append(sheet);
            if (row != null) sb.append(", row=").append(row);
            sb.append(']');
        }
        return sb.toString();
    }
}
