package com.axcockpit.backend.reconcile;

import com.axcockpit.backend.audit.AuditEntityType;
import com.axcockpit.backend.audit.AuditRecord;
import com.axcockpit.backend.audit.AuditRecorder;
import com.axcockpit.backend.domain.MonthlyEvent;
import com.axcockpit.backend.domain.MonthlyEventRevision;
import com.axcockpit.backend.domain.Project;
import com.axcockpit.backend.domain.Snapshot;
import com.axcockpit.backend.domain.Strategy;
import com.axcockpit.backend.ingest.excel.MasterRow;
import com.axcockpit.backend.ingest.excel.MonthlyRow;
import com.axcockpit.backend.ingest.excel.ParsedSnapshot;
import com.axcockpit.backend.repo.MonthlyEventRepository;
import com.axcockpit.backend.repo.MonthlyEventRevisionRepository;
import com.axcockpit.backend.repo.ProjectRepository;
import com.axcockpit.backend.repo.StrategyRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 파싱된 행을 Project / Strategy / MonthlyEvent 로 반영한다. 정본 저장소를 변경하는 유일한 경로이며,
 * 모든 생성/수정은 같은 트랜잭션 안에서 감사 로그 1건을 남긴다.
 *
 * 병합 정책: latest-snapshot-wins. 더 최근 스냅샷이 이미 반영한 값은 오래된 스냅샷이 덮어쓰지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EntityReconciler {

    public enum Outcome { CREATED, UPDATED, UNCHANGED, STALE }

    private final ProjectRepository projectRepository;
    private final StrategyRepository strategyRepository;
    private final MonthlyEventRepository eventRepository;
    private final MonthlyEventRevisionRepository revisionRepository;
    private final AuditRecorder auditRecorder;

    public StrategyCatalog openCatalog(String actor, LocalDate snapshotDate) {
        return new StrategyCatalog(strategyRepository, auditRecorder, actor, snapshotDate, strategyRepository.findAll());
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public ReconcileStats reconcile(ParsedSnapshot parsed, Snapshot snapshot, String actor) {
        LocalDate date = snapshot.getSnapshotDate();
        StrategyCatalog catalog = openCatalog(actor, date);

        List<String> codes = parsed.projects().stream().map(MasterRow::code).toList();
        Map<String, Project> byCode = projectRepository.findAllByCodeIn(codes).stream()
                .collect(Collectors.toMap(Project::getCode, Function.identity()));

        int created = 0, updated = 0;
        for (MasterRow row : parsed.projects()) {
            Project p = byCode.get(row.code());
            if (p == null) {
                p = createProject(row, catalog, actor, date);
                byCode.put(p.getCode(), p);
                created++;
            } else {
                boolean backdated = backdateCreation(p, actor, date);
                if (applyFields(p, ProjectFields.from(row), catalog, actor, date, true) == Outcome.UPDATED || backdated) {
                    updated++;
                }
            }
        }

        // 적재 대상 월의 기존 이벤트를 키로 색인
        Map<String, MonthlyEvent> existing = new HashMap<>();
        for (MonthlyEvent e : eventRepository.findAllByMonthKeyIn(parsed.monthly().keySet())) {
            existing.put(e.key(), e);
        }

        int eventsCreated = 0, eventsUpdated = 0;
        for (Map.Entry<String, List<MonthlyRow>> month : parsed.monthly().entrySet()) {
            for (MonthlyRow row : month.getValue()) {
                Project p = byCode.get(row.projectCode());
                for (MonthlyEvent.Kind kind : MonthlyEvent.Kind.values()) {
                    long count = kind == MonthlyEvent.Kind.PROPOSAL ? row.proposals() : row.approvals();
                    MonthlyEvent current = existing.get(MonthlyEvent.keyOf(p.getCode(), month.getKey(), kind));
                    if (current == null && count == 0) {
                        // 레코드 없음 == 0건
                        continue;
                    }
                    Outcome o = upsertEvent(p, month.getKey(), kind, count, row.note(), current, actor, date, true);
                    if (o == Outcome.CREATED) eventsCreated++;
                    else if (o == Outcome.UPDATED) eventsUpdated++;
                }
            }
        }

        ReconcileStats stats = new ReconcileStats(created, updated, catalog.createdCount(), eventsCreated, eventsUpdated);
        log.info("[reconcile] snapshot={} {}", date, stats);
        return stats;
    }

    private Project createProject(MasterRow row, StrategyCatalog catalog, String actor, LocalDate date) {
        Project p = new Project(row.code(), date);
        p.setName(row.name());
        p.setChampion(row.champion());
        p.setStrategy(catalog.resolve(row.strategy()));
        p.setStatus(row.status());
        p.setOrgUnit(row.orgUnit());
        p.setProposedMonth(row.proposedMonth());
        p.setApprovedMonth(row.approvedMonth());
        p = projectRepository.save(p);
        auditRecorder.record(AuditRecord.created(AuditEntityType.PROJECT, p.getCode(), p.toAuditState(), actor, date));
        return p;
    }

    /** 늦게 적재된 과거 스냅샷에도 있던 과제는 최초 등장일을 앞당긴다 */
    private boolean backdateCreation(Project p, String actor, LocalDate date) {
        if (!p.getCreatedSnapshotDate().isAfter(date)) return false;
        Map<String, Object> before = p.toAuditState();
        p.setCreatedSnapshotDate(date);
        projectRepository.save(p);
        auditRecorder.record(AuditRecord.updated(AuditEntityType.PROJECT, p.getCode(), before, p.toAuditState(), actor, date));
        return true;
    }

    /**
     * 다른 필드만 갱신하고 필드 단위 diff 를 감사 로그로 남긴다. 스냅샷 적재와 직접 편집이 같이 쓰는 경로.
     *
     * @param fromSnapshot true 면 date 를 스냅샷 날짜로 보고 last-updated 를 갱신, 더 오래된 스냅샷이면 무시
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Outcome applyFields(Project p, ProjectFields f, StrategyCatalog catalog,
                               String actor, LocalDate date, boolean fromSnapshot) {
        if (fromSnapshot && p.getConfirmedSnapshotDate().isAfter(date)) {
            log.info("[reconcile] project {} already reflects snapshot {}; {} ignored",
                    p.getCode(), p.getConfirmedSnapshotDate(), date);
            return Outcome.STALE;
        }
        if (fromSnapshot) {
            // 값이 그대로여도 더 최근 스냅샷이 확인한 것으로 기록
            p.setConfirmedSnapshotDate(date);
        }

        Map<String, Object> before = p.toAuditState();
        boolean dirty = false;
        if (!Objects.equals(f.name(), p.getName())) { p.setName(f.name()); dirty = true; }
        if (!Objects.equals(f.champion(), p.getChampion())) { p.setChampion(f.champion()); dirty = true; }
        if (!Strategy.keyOf(f.strategy()).equals(p.getStrategy().getNameKey())) {
            p.setStrategy(catalog.resolve(f.strategy()));
            dirty = true;
        }
        if (!Objects.equals(f.status(), p.getStatus())) { p.setStatus(f.status()); dirty = true; }
        if (!Objects.equals(f.orgUnit(), p.getOrgUnit())) { p.setOrgUnit(f.orgUnit()); dirty = true; }
        if (!Objects.equals(f.proposedMonth(), p.getProposedMonth())) { p.setProposedMonth(f.proposedMonth()); dirty = true; }
        if (!Objects.equals(f.approvedMonth(), p.getApprovedMonth())) { p.setApprovedMonth(f.approvedMonth()); dirty = true; }

        if (!dirty) return Outcome.UNCHANGED;

        if (fromSnapshot) {
            p.setLastUpdatedSnapshotDate(date);
        }
        projectRepository.save(p);
        auditRecorder.record(AuditRecord.updated(AuditEntityType.PROJECT, p.getCode(), before, p.toAuditState(),
                actor, fromSnapshot ? date : null));
        return Outcome.UPDATED;
    }

    /**
     * (과제, 월, 구분) 업서트. 건수가 새로 생기거나 바뀌면 이력 원장에도 한 줄 추가한다.
     *
     * @param current 이미 조회한 기존 레코드(없으면 null)
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Outcome upsertEvent(Project p, String monthKey, MonthlyEvent.Kind kind, long count, String note,
                               MonthlyEvent current, String actor, LocalDate sourceDate, boolean fromSnapshot) {
        if (current == null) {
            MonthlyEvent e = new MonthlyEvent(p, monthKey, kind);
            e.setCount(count);
            e.setNote(note);
            e.setSourceSnapshotDate(sourceDate);
            e.setConfirmedSnapshotDate(sourceDate);
            e = eventRepository.save(e);
            revisionRepository.save(MonthlyEventRevision.of(e));
            auditRecorder.record(AuditRecord.created(AuditEntityType.MONTHLY_EVENT, e.key(), e.toAuditState(),
                    actor, fromSnapshot ? sourceDate : null));
            return Outcome.CREATED;
        }

        if (current.getConfirmedSnapshotDate().isAfter(sourceDate)) {
            // 현재값은 유지하되, 해당 날짜 기준 조회를 위해 이력은 남긴다
            revisionRepository.save(new MonthlyEventRevision(p.getCode(), monthKey, kind, count, sourceDate));
            log.info("[reconcile] {} already reflects snapshot {}; kept, revision at {} recorded",
                    current.key(), current.getConfirmedSnapshotDate(), sourceDate);
            return Outcome.STALE;
        }

        boolean countChanged = current.getCount() != count;
        boolean noteChanged = !Objects.equals(current.getNote(), note);
        if (!countChanged && !noteChanged) {
            if (fromSnapshot && sourceDate.isAfter(current.getConfirmedSnapshotDate())) {
                // 같은 값을 다시 확인한 스냅샷도 이력에 남겨야 asOf 조회가 늦게 들어온 과거값에 밀리지 않는다
                current.setConfirmedSnapshotDate(sourceDate);
                eventRepository.save(current);
                revisionRepository.save(new MonthlyEventRevision(p.getCode(), monthKey, kind, count, sourceDate));
            }
            return Outcome.UNCHANGED;
        }

        Map<String, Object> before = current.toAuditState();
        current.setCount(count);
        current.setNote(note);
        current.setSourceSnapshotDate(sourceDate);
        current.setConfirmedSnapshotDate(sourceDate);
        eventRepository.save(current);
        if (countChanged) {
            revisionRepository.save(MonthlyEventRevision.of(current));
        }
        auditRecorder.record(AuditRecord.updated(AuditEntityType.MONTHLY_EVENT, current.key(), before,
                current.toAuditState(), actor, fromSnapshot ? sourceDate : null));
        return Outcome.UPDATED;
    }
}
