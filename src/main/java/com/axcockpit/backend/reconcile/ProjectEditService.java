package com.axcockpit.backend.reconcile;

import com.axcockpit.backend.audit.AuditEntityType;
import com.axcockpit.backend.audit.AuditRecord;
import com.axcockpit.backend.audit.AuditRecorder;
import com.axcockpit.backend.domain.MonthlyEvent;
import com.axcockpit.backend.domain.Project;
import com.axcockpit.backend.domain.Snapshot;
import com.axcockpit.backend.domain.Strategy;
import com.axcockpit.backend.error.CockpitException;
import com.axcockpit.backend.error.ErrorKind;
import com.axcockpit.backend.ingest.excel.SnapshotParser;
import com.axcockpit.backend.repo.MonthlyEventRepository;
import com.axcockpit.backend.repo.ProjectRepository;
import com.axcockpit.backend.repo.SnapshotRepository;
import com.axcockpit.backend.repo.StrategyRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.Map;
import java.util.Objects;

/**
 * 관리자 직접 편집. 호출 1건 = 트랜잭션 1건이며, 스냅샷 적재와 같은 갱신 경로/감사 로그를 탄다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional
public class ProjectEditService {

    private final EntityReconciler reconciler;
    private final ProjectRepository projectRepository;
    private final StrategyRepository strategyRepository;
    private final MonthlyEventRepository eventRepository;
    private final SnapshotRepository snapshotRepository;
    private final AuditRecorder auditRecorder;

    public Project updateProject(String code, ProjectFields changes, String actor) {
        Project p = projectRepository.findByCode(code)
                .orElseThrow(() -> CockpitException.unknownEntity("Project", code));

        ProjectFields merged = changes.overlayOn(p);
        requireNotBlank("name", merged.name());
        requireNotBlank("champion", merged.champion());
        requireNotBlank("strategy", merged.strategy());
        requireNotBlank("status", merged.status());

        StrategyCatalog catalog = reconciler.openCatalog(actor, null);
        EntityReconciler.Outcome outcome = reconciler.applyFields(p, merged, catalog, actor, null, false);
        log.info("[reconcile] edit project={} by={} -> {}", code, actor, outcome);
        return p;
    }

    public MonthlyEvent updateMonthlyEvent(String code, String monthKey, MonthlyEvent.Kind kind, long count, String actor) {
        Project p = projectRepository.findByCode(code)
                .orElseThrow(() -> CockpitException.unknownEntity("Project", code));
        if (monthKey == null || !SnapshotParser.MONTH_SHEET_PATTERN.matcher(monthKey).matches()) {
            throw new CockpitException(ErrorKind.CONSTRAINT_VIOLATION, "Month key must be YYYY-MM: " + monthKey);
        }
        if (count < 0) {
            throw new CockpitException(ErrorKind.INVALID_EVENT_COUNT, "Negative count " + count + " for " + code);
        }

        // 직접 편집 값의 출처는 가장 최근 적재 스냅샷으로 본다
        LocalDate source = snapshotRepository.findTopByOrderBySnapshotDateDesc()
                .map(Snapshot::getSnapshotDate)
                .orElse(LocalDate.now());

        MonthlyEvent current = eventRepository.findByProjectAndMonthKeyAndKind(p, monthKey, kind).orElse(null);
        String note = current == null ? null : current.getNote();
        EntityReconciler.Outcome outcome =
                reconciler.upsertEvent(p, monthKey, kind, count, note, current, actor, source, false);
        log.info("[reconcile] edit event={} count={} by={} -> {}",
                MonthlyEvent.keyOf(code, monthKey, kind), count, actor, outcome);

        return eventRepository.findByProjectAndMonthKeyAndKind(p, monthKey, kind)
                .orElseThrow(() -> new IllegalStateException("event vanished after upsert"));
    }

    public Strategy deprecateStrategy(String name, String actor) {
        Strategy s = findStrategy(name);
        if (s.isDeprecated()) return s;

        Map<String, Object> before = s.toAuditState();
        s.setDeprecated(true);
        strategyRepository.save(s);
        auditRecorder.record(AuditRecord.updated(AuditEntityType.STRATEGY, s.getName(), before, s.toAuditState(), actor, null));
        log.info("[reconcile] strategy '{}' deprecated by {}", s.getName(), actor);
        return s;
    }

    public Strategy describeStrategy(String name, String description, String actor) {
        Strategy s = findStrategy(name);
        String value = description == null || description.isBlank() ? null : description.trim();
        if (Objects.equals(value, s.getDescription())) return s;

        Map<String, Object> before = s.toAuditState();
        s.setDescription(value);
        strategyRepository.save(s);
        auditRecorder.record(AuditRecord.updated(AuditEntityType.STRATEGY, s.getName(), before, s.toAuditState(), actor, null));
        log.info("[reconcile] strategy '{}' description updated by {}", s.getName(), actor);
        return s;
    }

    public void deleteStrategy(String name, String actor) {
        Strategy s = findStrategy(name);
        if (projectRepository.existsByStrategy(s)) {
            throw new CockpitException(ErrorKind.CONSTRAINT_VIOLATION,
                    "Strategy '" + s.getName() + "' is referenced by projects; deprecate it instead");
        }
        strategyRepository.delete(s);
        auditRecorder.record(AuditRecord.deleted(AuditEntityType.STRATEGY, s.getName(), s.toAuditState(), actor));
        log.info("[reconcile] strategy '{}' deleted by {}", s.getName(), actor);
    }

    private Strategy findStrategy(String name) {
        return strategyRepository.findByNameKey(Strategy.keyOf(name))
                .orElseThrow(() -> CockpitException.unknownEntity("Strategy", name));
    }

    private static void requireNotBlank(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new CockpitException(ErrorKind.CONSTRAINT_VIOLATION, "Required field '" + field + "' is blank");
        }
    }
}
