package com.axcockpit.backend.ingest;

import com.axcockpit.backend.error.CockpitException;
import com.axcockpit.backend.error.ErrorKind;
import com.axcockpit.backend.ingest.excel.ParsedSnapshot;
import com.axcockpit.backend.reconcile.ReconcileStats;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestReport {
    private boolean success;
    private LocalDate snapshotDate;
    private String filename;
    private int acceptedRows;
    private int rejectedRows;
    private int projectsCreated;
    private int projectsUpdated;
    private int strategiesCreated;
    private int eventsWritten;
    private List<String> warnings;
    private Error error;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Error {
        private ErrorKind kind;
        private String detail;
        private String sheet;
        private Integer row;
    }

    public static IngestReport success(ParsedSnapshot parsed, String filename, ReconcileStats stats) {
        return IngestReport.builder()
                .success(true)
                .snapshotDate(parsed.snapshotDate())
                .filename(filename)
                .acceptedRows(parsed.acceptedRows())
                .rejectedRows(parsed.rejectedRows())
                .projectsCreated(stats.projectsCreated())
                .projectsUpdated(stats.projectsUpdated())
                .strategiesCreated(stats.strategiesCreated())
                .eventsWritten(stats.eventsCreated() + stats.eventsUpdated())
                .warnings(parsed.warnings())
                .build();
    }

    public static IngestReport failure(LocalDate snapshotDate, String filename, CockpitException e) {
        return IngestReport.builder()
                .success(false)
                .snapshotDate(snapshotDate)
                .filename(filename)
                .warnings(List.of())
                .error(new Error(e.getKind(), e.getDetail(), e.getSheet(), e.getRow()))
                .build();
    }
}
