package com.axcockpit.backend.ingest.excel;

import com.axcockpit.backend.error.CockpitException;
import com.axcockpit.backend.error.ErrorKind;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.ss.usermodel.*;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * POI 워크북을 시트/행/셀 값으로 펼친다. 업무 규칙 검증은 하지 않는다.
 */
@Slf4j
@Component
public class WorkbookReader {

    public WorkbookData read(InputStream in) {
        try (Workbook workbook = WorkbookFactory.create(in)) {
            int count = workbook.getNumberOfSheets();
            if (count == 0) {
                throw new CockpitException(ErrorKind.MALFORMED_DOCUMENT, "workbook has no sheets");
            }
            List<WorkbookData.Sheet> sheets = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                sheets.add(readSheet(workbook.getSheetAt(i)));
            }
            log.debug("[ingest] workbook opened sheets={}", workbook.getNumberOfSheets());
            return new WorkbookData(Collections.unmodifiableList(sheets));
        } catch (CockpitException e) {
            throw e;
        } catch (IOException | EncryptedDocumentException e) {
            throw new CockpitException(ErrorKind.MALFORMED_DOCUMENT, "Failed to open workbook: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            // POI 는 손상된 zip/xml 에 대해 다양한 런타임 예외를 던진다
            throw new CockpitException(ErrorKind.MALFORMED_DOCUMENT, "Failed to read workbook: " + e, e);
        }
    }

    private WorkbookData.Sheet readSheet(Sheet sheet) {
        Row headerRow = sheet.getRow(sheet.getFirstRowNum());
        if (headerRow == null || sheet.getPhysicalNumberOfRows() == 0) {
            return new WorkbookData.Sheet(sheet.getSheetName(), List.of(), List.of());
        }

        // 컬럼 인덱스 → 헤더명
        Map<Integer, String> headerAt = new LinkedHashMap<>();
        for (Cell cell : headerRow) {
            Object v = cellValue(cell);
            if (v != null) {
                headerAt.put(cell.getColumnIndex(), v.toString().trim());
            }
        }

        List<WorkbookData.Row> rows = new ArrayList<>();
        for (int r = headerRow.getRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
            Row row = sheet.getRow(r);
            if (row == null) continue;

            Map<String, Object> values = new LinkedHashMap<>();
            boolean blank = true;
            for (Map.Entry<Integer, String> h : headerAt.entrySet()) {
                Object v = cellValue(row.getCell(h.getKey()));
                values.put(h.getValue(), v);
                if (v != null) blank = false;
            }
            if (blank) continue;
            rows.add(new WorkbookData.Row(r + 1, Collections.unmodifiableMap(values)));
        }
        return new WorkbookData.Sheet(sheet.getSheetName(),
                List.copyOf(headerAt.values()), Collections.unmodifiableList(rows));
    }

    /** 수식 셀은 저장된 결과값을 쓴다 */
    static Object cellValue(Cell cell) {
        if (cell == null) return null;
        CellType type = cell.getCellType();
        if (type == CellType.FORMULA) {
            type = cell.getCachedFormulaResultType();
        }
        return switch (type) {
            case STRING -> {
                String s = cell.getStringCellValue();
                yield (s == null || s.isBlank()) ? null : s.trim();
            }
            case NUMERIC -> DateUtil.isCellDateFormatted(cell)
                    ? cell.getLocalDateTimeCellValue().toLocalDate()
                    : (Object) cell.getNumericCellValue();
            case BOOLEAN -> cell.getBooleanCellValue();
            default -> null;
        };
    }
}
