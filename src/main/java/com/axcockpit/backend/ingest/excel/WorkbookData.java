package com.axcockpit.backend.ingest.excel;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 읽어 들인 워크북. 시트 순서는 원본 순서를 유지한다.
 */
public record WorkbookData(List<Sheet> sheets) {

    public List<String> sheetNames() {
        return sheets.stream().map(Sheet::name).toList();
    }

    public Optional<Sheet> sheet(String name) {
        return sheets.stream().filter(s -> s.name().equals(name)).findFirst();
    }

    /** headers: 1행(trim), rows: 2행부터 비어 있지 않은 행 */
    public record Sheet(String name, List<String> headers, List<Row> rows) {}

    /**
     * rowNumber 는 엑셀 화면 기준(1부터). 값은 String / Double / LocalDate / Boolean / null.
     */
    public record Row(int rowNumber, Map<String, Object> values) {
        public Object get(String header) {
            return values.get(header);
        }
    }
}
