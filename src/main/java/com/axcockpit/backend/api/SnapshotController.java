package com.axcockpit.backend.api;

import com.axcockpit.backend.domain.Snapshot;
import com.axcockpit.backend.error.ErrorKind;
import com.axcockpit.backend.ingest.IngestReport;
import com.axcockpit.backend.ingest.SnapshotIngestService;
import com.axcockpit.backend.repo.SnapshotRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequiredArgsConstructor
public class SnapshotController {

    private final SnapshotIngestService ingestService;
    private final SnapshotRepository snapshotRepository;
    private final RequestActor requestActor;

    /**
     * 스냅샷 업로드. snapshotDate 를 주지 않으면 파일명(YYYY-MM-DD.xlsx)에서 얻는다.
     */
    @PostMapping("/admin/snapshots")
    public ResponseEntity<IngestReport> upload(@RequestParam("file") MultipartFile file,
                                               @RequestParam(required = false)
                                               @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate snapshotDate,
                                               @RequestHeader(value = RequestActor.HEADER, required = false) String actor)
            throws IOException {
        String who = requestActor.resolve(actor);
        IngestReport report;
        try (InputStream in = file.getInputStream()) {
            report = snapshotDate == null
                    ? ingestService.ingest(in, file.getOriginalFilename(), who)
                    : ingestService.ingest(in, snapshotDate, file.getOriginalFilename(), who);
        }
        return ResponseEntity.status(statusOf(report)).body(report);
    }

    @GetMapping("/api/snapshots")
    public List<Map<String, Object>> list() {
        return snapshotRepository.findAllByOrderBySnapshotDateDesc().stream()
                .map(SnapshotController::view)
                .toList();
    }

    private static HttpStatus statusOf(IngestReport report) {
        if (report.isSuccess()) return HttpStatus.CREATED;
        return report.getError().getKind() == ErrorKind.DUPLICATE_SNAPSHOT
                ? HttpStatus.CONFLICT
                : HttpStatus.UNPROCESSABLE_ENTITY;
    }

    private static Map<String, Object> view(Snapshot s) {
        Map<String, Object> m = new LinkedHashMap<>(s.toAuditState());
        m.put("ingestedAt", s.getIngestedAt());
        return m;
    }
}
