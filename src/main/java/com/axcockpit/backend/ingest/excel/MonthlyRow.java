package com.axcockpit.backend.ingest.excel;

/**
 * 월별 시트의 과제 1건(같은 시트 내 중복 행은 합산된 상태).
 */
public record MonthlyRow(String monthKey,
                         int rowNumber,
                         String projectCode,
                         long proposals,
                         long approvals,
                         String note) {}
