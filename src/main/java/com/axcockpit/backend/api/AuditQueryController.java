package com.axcockpit.backend.api;

import com.axcockpit.backend.audit.AuditEntityType;
import com.axcockpit.backend.domain.AuditLog;
import com.axcockpit.backend.repo.AuditLogRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequiredArgsConstructor
public class AuditQueryController {

    private final AuditLogRepository auditLogRepository;

    /** 필터가 없으면 최근 100건(최신순) */
    @GetMapping("/admin/audit")
    public List<AuditLog> audit(@RequestParam(required = false) AuditEntityType entityType,
                                @RequestParam(required = false) String entityId) {
        if (entityType == null) {
            return auditLogRepository.findTop100ByOrderByIdDesc();
        }
        if (entityId == null) {
            return auditLogRepository.findAllByEntityTypeOrderByIdAsc(entityType);
        }
        return auditLogRepository.findAllByEntityTypeAndEntityIdOrderByIdAsc(entityType, entityId);
    }
}
