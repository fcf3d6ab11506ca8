package com.axcockpit.backend.error;

public enum ErrorKind {
    /** 워크북을 열 수 없거나 시트가 없음 */
    MALFORMED_DOCUMENT,
    /** 파일명이 YYYY-MM-DD.xlsx 가 아님 */
    INVALID_FILENAME,
    MISSING_MASTER_SHEET,
    /** 필수 헤더 누락 */
    MISSING_COLUMNS,
    INVALID_MASTER_ROW,
    ORPHAN_MONTHLY_ROW,
    INVALID_EVENT_COUNT,
    DUPLICATE_SNAPSHOT,
    UNKNOWN_ENTITY,
    CONSTRAINT_VIOLATION
}
