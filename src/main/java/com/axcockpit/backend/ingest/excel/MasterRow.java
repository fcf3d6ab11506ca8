package com.axcockpit.backend.ingest.excel;

/**
 * AX_Master 한 행. 필수 필드(code, name, champion, strategy, status)는 비어 있지 않다.
 */
public record MasterRow(int rowNumber,
                        String code,
                        String name,
                        String champion,
                        String strategy,
                        String status,
                        String orgUnit,
                        String proposedMonth,
                        String approvedMonth) {}
