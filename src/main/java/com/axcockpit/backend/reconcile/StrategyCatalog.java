package com.axcockpit.backend.reconcile;

import com.axcockpit.backend.audit.AuditEntityType;
import com.axcockpit.backend.audit.AuditRecord;
import com.axcockpit.backend.audit.AuditRecorder;
import com.axcockpit.backend.domain.Strategy;
import com.axcockpit.backend.repo.StrategyRepository;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 한 트랜잭션 동안 쓰는 전략 목록. 이름(trim + 소문자)으로 찾고, 없으면 만들어 감사 로그를 남긴다.
 */
@Slf4j
public class StrategyCatalog {

    private final StrategyRepository strategyRepository;
    private final AuditRecorder auditRecorder;
    private final String actor;
    private final LocalDate snapshotDate;
    private final Map<String, Strategy> byKey = new HashMap<>();
    private int created = 0;

    StrategyCatalog(StrategyRepository strategyRepository, AuditRecorder auditRecorder,
                    String actor, LocalDate snapshotDate, List<Strategy> existing) {
        this.strategyRepository = strategyRepository;
        this.auditRecorder = auditRecorder;
        this.actor = actor;
        this.snapshotDate = snapshotDate;
        for (Strategy s : existing) {
            byKey.put(s.getNameKey(), s);
        }
    }

    public Strategy resolve(String name) {
        String key = Strategy.keyOf(name);
        if (key.isEmpty()) {
            throw new IllegalArgumentException("strategy name is blank");
        }
        Strategy s = byKey.get(key);
        if (s != null) {
            if (s.isDeprecated()) {
                log.warn("[reconcile] deprecated strategy '{}' is still referenced", s.getName());
            }
            return s;
        }

        s = strategyRepository.save(new Strategy(name));
        byKey.put(key, s);
        created++;
        auditRecorder.record(AuditRecord.created(AuditEntityType.STRATEGY, s.getName(), s.toAuditState(), actor, snapshotDate));
        log.info("[reconcile] new strategy '{}'", s.getName());
        return s;
    }

    public int createdCount() {
        return created;
    }
}
