package com.axcockpit.backend.ingest;

import com.axcockpit.backend.audit.AuditEntityType;
import com.axcockpit.backend.audit.AuditRecord;
import com.axcockpit.backend.audit.AuditRecorder;
import com.axcockpit.backend.domain.Snapshot;
import com.axcockpit.backend.ingest.excel.ParsedSnapshot;
import com.axcockpit.backend.reconcile.EntityReconciler;
import com.axcockpit.backend.reconcile.ReconcileStats;
import com.axcockpit.backend.repo.SnapshotRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 스냅샷 1건 반영 = 트랜잭션 1건. 중간에 하나라도 실패하면 감사 로그까지 전부 롤백된다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SnapshotCommitter {

    private final SnapshotValidator validator;
    private final SnapshotRepository snapshotRepository;
    private final EntityReconciler reconciler;
    private final AuditRecorder auditRecorder;

    @Transactional
    public ReconcileStats commit(ParsedSnapshot parsed, String filename, String actor) {
        validator.requireNotIngested(parsed.snapshotDate());
        validator.validate(parsed);

        // 먼저 flush 해서 snapshot_date 유니크 인덱스로 동시 적재를 막는다
        Snapshot snapshot = snapshotRepository.saveAndFlush(
                new Snapshot(parsed.snapshotDate(), filename, parsed.acceptedRows(), parsed.rejectedRows()));
        auditRecorder.record(AuditRecord.created(AuditEntityType.SNAPSHOT, snapshot.getSnapshotDate().toString(),
                snapshot.toAuditState(), actor, snapshot.getSnapshotDate()));

        return reconciler.reconcile(parsed, snapshot, actor);
    }
}
