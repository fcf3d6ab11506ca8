package com.axcockpit.backend;

import com.axcockpit.backend.audit.AuditEntityType;
import com.axcockpit.backend.domain.AuditLog;
import com.axcockpit.backend.ingest.IngestReport;
import com.axcockpit.backend.ingest.SnapshotIngestService;
import com.axcockpit.backend.ingest.TestWorkbook;
import com.axcockpit.backend.repo.*;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

/**
 * H2 위에서 전체 컨텍스트를 띄우는 테스트의 공통 부분. 매 테스트 전에 저장소를 비운다.
 */
@SpringBootTest
public abstract class StoreTestSupport {

    @Autowired protected SnapshotIngestService ingestService;
    @Autowired protected ProjectRepository projectRepository;
    @Autowired protected StrategyRepository strategyRepository;
    @Autowired protected MonthlyEventRepository eventRepository;
    @Autowired protected MonthlyEventRevisionRepository revisionRepository;
    @Autowired protected SnapshotRepository snapshotRepository;
    @Autowired protected AuditLogRepository auditLogRepository;

    @BeforeEach
    protected void cleanStore() {
        auditLogRepository.deleteAllInBatch();
        revisionRepository.deleteAllInBatch();
        eventRepository.deleteAllInBatch();
        projectRepository.deleteAllInBatch();
        strategyRepository.deleteAllInBatch();
        snapshotRepository.deleteAllInBatch();
    }

    protected IngestReport ingest(String filename, TestWorkbook workbook) {
        return ingestService.ingest(workbook.stream(), filename, "tester");
    }

    protected List<AuditLog> audit(AuditEntityType type, String id) {
        return auditLogRepository.findAllByEntityTypeAndEntityIdOrderByIdAsc(type, id);
    }
}
