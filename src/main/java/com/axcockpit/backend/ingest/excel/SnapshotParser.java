package com.axcockpit.backend.ingest.excel;

import com.axcockpit.backend.config.CockpitProps;
import com.axcockpit.backend.error.CockpitException;
import com.axcockpit.backend.error.ErrorKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.*;
import java.util.regex.Pattern;

/**
 * AX_Master + YYYY-MM 시트를 타입이 정해진 행 레코드로 변환한다.
 * 부수효과가 없으므로 실패 시 그대로 재시도할 수 있다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SnapshotParser {

    public static final Pattern MONTH_SHEET_PATTERN = Pattern.compile("^\\d{4}-(0[1-9]|1[0-2])$");

    private final CockpitProps props;

    public ParsedSnapshot parse(WorkbookData workbook, LocalDate snapshotDate) {
        CockpitProps.Ingest cfg = props.getIngest();
        List<String> warnings = new ArrayList<>();

        WorkbookData.Sheet master = workbook.sheet(cfg.getMasterSheet())
                .orElseThrow(() -> new CockpitException(ErrorKind.MISSING_MASTER_SHEET,
                        cfg.getMasterSheet() + " sheet is missing", cfg.getMasterSheet(), null));
        requireColumns(master, cfg.getMasterColumns().required());

        List<MasterRow> projects = parseMaster(master, cfg.getMasterColumns());
        Set<String> knownCodes = new HashSet<>();
        for (MasterRow p : projects) knownCodes.add(p.code());

        int accepted = projects.size();
        int rejected = 0;
        Map<String, List<MonthlyRow>> monthly = new TreeMap<>();

        for (WorkbookData.Sheet sheet : workbook.sheets()) {
            if (sheet.name().equals(cfg.getMasterSheet())) continue;
            if (!MONTH_SHEET_PATTERN.matcher(sheet.name()).matches()) {
                warnings.add("Sheet " + sheet.name() + " ignored due to invalid name");
                continue;
            }
            requireColumns(sheet, cfg.getMonthlyColumns().required());

            MonthlySheetResult r = parseMonthly(sheet, cfg.getMonthlyColumns(), knownCodes, warnings);
            accepted += r.accepted();
            rejected += r.rejected();
            // 시트명 중복은 엑셀에서 불가능하므로 월 키는 유일
            monthly.put(sheet.name(), r.rows());
        }

        log.info("[ingest] parsed snapshot={} projects={} months={} accepted={} rejected={}",
                snapshotDate, projects.size(), monthly.keySet(), accepted, rejected);
        return new ParsedSnapshot(snapshotDate, List.copyOf(projects), Collections.unmodifiableMap(monthly),
                accepted, rejected, List.copyOf(warnings));
    }

    private List<MasterRow> parseMaster(WorkbookData.Sheet sheet, CockpitProps.MasterColumns col) {
        List<MasterRow> rows = new ArrayList<>(sheet.rows().size());
        Map<String, Integer> seenAt = new HashMap<>();

        for (WorkbookData.Row row : sheet.rows()) {
            String code = required(sheet, row, col.getProjectId());
            String name = required(sheet, row, col.getName());
            String champion = required(sheet, row, col.getChampion());
            String strategy = required(sheet, row, col.getStrategy());
            String status = required(sheet, row, col.getStatus());

            Integer first = seenAt.putIfAbsent(code, row.rowNumber());
            if (first != null) {
                throw CockpitException.atRow(ErrorKind.INVALID_MASTER_ROW, sheet.name(), row.rowNumber(),
                        "Duplicate project ID " + code + " (first seen at row " + first + ")");
            }

            rows.add(new MasterRow(row.rowNumber(), code, name, champion, strategy, status,
                    CellValues.text(row.get(col.getOrgUnit())),
                    CellValues.month(row.get(col.getProposedMonth())),
                    CellValues.month(row.get(col.getApprovedMonth()))));
        }
        return rows;
    }

    private MonthlySheetResult parseMonthly(WorkbookData.Sheet sheet, CockpitProps.MonthlyColumns col,
                                            Set<String> knownCodes, List<String> warnings) {
        // 같은 과제가 여러 행이면 합산, 첫 행 위치 유지
        Map<String, MonthlyRow> byCode = new LinkedHashMap<>();
        int accepted = 0;
        int rejected = 0;

        for (WorkbookData.Row row : sheet.rows()) {
            String code = CellValues.text(row.get(col.getProjectId()));
            if (code == null) {
                warnings.add("Blank project ID in " + sheet.name() + " row " + row.rowNumber() + "; row skipped");
                rejected++;
                continue;
            }
            if (!knownCodes.contains(code)) {
                throw CockpitException.atRow(ErrorKind.ORPHAN_MONTHLY_ROW, sheet.name(), row.rowNumber(),
                        "Project ID " + code + " in sheet " + sheet.name() + " not found in master sheet");
            }
            long proposals = CellValues.count(row.get(col.getProposals()), sheet.name(), row.rowNumber(), col.getProposals());
            long approvals = CellValues.count(row.get(col.getApprovals()), sheet.name(), row.rowNumber(), col.getApprovals());
            String note = CellValues.text(row.get(col.getNote()));

            MonthlyRow prev = byCode.get(code);
            if (prev == null) {
                byCode.put(code, new MonthlyRow(sheet.name(), row.rowNumber(), code, proposals, approvals, note));
            } else {
                byCode.put(code, new MonthlyRow(sheet.name(), prev.rowNumber(), code,
                        prev.proposals() + proposals, prev.approvals() + approvals, joinNotes(prev.note(), note)));
            }
            accepted++;
        }
        return new MonthlySheetResult(List.copyOf(byCode.values()), accepted, rejected);
    }

    private static String required(WorkbookData.Sheet sheet, WorkbookData.Row row, String header) {
        String v = CellValues.text(row.get(header));
        if (v == null) {
            throw CockpitException.atRow(ErrorKind.INVALID_MASTER_ROW, sheet.name(), row.rowNumber(),
                    "Required field '" + header + "' is empty");
        }
        return v;
    }

    private static void requireColumns(WorkbookData.Sheet sheet, List<String> required) {
        List<String> missing = required.stream()
                .filter(h -> !sheet.headers().contains(h))
                .toList();
        if (!missing.isEmpty()) {
            throw new CockpitException(ErrorKind.MISSING_COLUMNS,
                    "Missing required columns in " + sheet.name() + ": " + String.join(", ", missing),
                    sheet.name(), 1);
        }
    }

    private static String joinNotes(String a, String b) {
        if (a == null) return b;
        if (b == null || a.equals(b)) return a;
        return a + "; " + b;
    }

    private record MonthlySheetResult(List<MonthlyRow> rows, int accepted, int rejected) {}
}
