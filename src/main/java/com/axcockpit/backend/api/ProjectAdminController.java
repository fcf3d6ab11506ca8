package com.axcockpit.backend.api;

import com.axcockpit.backend.domain.MonthlyEvent;
import com.axcockpit.backend.domain.Project;
import com.axcockpit.backend.domain.Strategy;
import com.axcockpit.backend.reconcile.ProjectEditService;
import com.axcockpit.backend.reconcile.ProjectFields;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * 과제/월별 이벤트/전략 직접 편집
 */
@RestController
@RequestMapping("/admin")
@RequiredArgsConstructor
public class ProjectAdminController {

    private final ProjectEditService editService;
    private final RequestActor requestActor;

    public record EventCountRequest(long count) {}

    public record StrategyRequest(String description) {}

    @PutMapping("/projects/{code}")
    public Map<String, Object> updateProject(@PathVariable String code,
                                             @RequestBody ProjectFields body,
                                             @RequestHeader(value = RequestActor.HEADER, required = false) String actor) {
        Project p = editService.updateProject(code, body, requestActor.resolve(actor));
        return p.toAuditState();
    }

    @PutMapping("/events/{code}/{month}/{kind}")
    public Map<String, Object> updateEvent(@PathVariable String code,
                                           @PathVariable String month,
                                           @PathVariable MonthlyEvent.Kind kind,
                                           @RequestBody EventCountRequest body,
                                           @RequestHeader(value = RequestActor.HEADER, required = false) String actor) {
        MonthlyEvent e = editService.updateMonthlyEvent(code, month, kind, body.count(), requestActor.resolve(actor));
        return e.toAuditState();
    }

    @PostMapping("/strategies/{name}/deprecate")
    public Map<String, Object> deprecate(@PathVariable String name,
                                         @RequestHeader(value = RequestActor.HEADER, required = false) String actor) {
        Strategy s = editService.deprecateStrategy(name, requestActor.resolve(actor));
        return s.toAuditState();
    }

    @PutMapping("/strategies/{name}")
    public Map<String, Object> describe(@PathVariable String name,
                                        @RequestBody StrategyRequest body,
                                        @RequestHeader(value = RequestActor.HEADER, required = false) String actor) {
        Strategy s = editService.describeStrategy(name, body.description(), requestActor.resolve(actor));
        return s.toAuditState();
    }

    @DeleteMapping("/strategies/{name}")
    public ResponseEntity<Void> delete(@PathVariable String name,
                                       @RequestHeader(value = RequestActor.HEADER, required = false) String actor) {
        editService.deleteStrategy(name, requestActor.resolve(actor));
        return ResponseEntity.noContent().build();
    }
}
