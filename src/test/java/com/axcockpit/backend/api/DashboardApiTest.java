package com.axcockpit.backend.api;

import com.axcockpit.backend.audit.AuditEntityType;
import com.axcockpit.backend.metrics.MetricsEngine;
import com.axcockpit.backend.metrics.MetricsWindow;
import com.axcockpit.backend.metrics.dto.DashboardMetrics;
import com.axcockpit.backend.repo.AuditLogRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDate;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = {DashboardController.class, AuditQueryController.class})
class DashboardApiTest {

    @Autowired MockMvc mvc;

    @MockBean MetricsEngine metricsEngine;
    @MockBean AuditLogRepository auditLogRepository;

    @Test
    void singleMonthWindow() throws Exception {
        when(metricsEngine.computeMetrics(any())).thenReturn(
                DashboardMetrics.builder().fromMonth("2025-03").toMonth("2025-03").warnings(List.of()).build());

        mvc.perform(get("/api/dashboard").param("month", "2025-03"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.fromMonth").value("2025-03"));

        verify(metricsEngine).computeMetrics(MetricsWindow.single("2025-03"));
    }

    @Test
    void rangeWithAsOf() throws Exception {
        when(metricsEngine.computeMetrics(any())).thenReturn(DashboardMetrics.builder().build());

        mvc.perform(get("/api/dashboard")
                        .param("from", "2025-01")
                        .param("to", "2025-06")
                        .param("asOf", "2025-04-30"))
                .andExpect(status().isOk());

        verify(metricsEngine).computeMetrics(
                new MetricsWindow("2025-01", "2025-06", LocalDate.of(2025, 4, 30)));
    }

    @Test
    void malformedMonthIs409() throws Exception {
        mvc.perform(get("/api/dashboard").param("month", "2025-13"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.kind").value("CONSTRAINT_VIOLATION"));

        verifyNoInteractions(metricsEngine);
    }

    @Test
    void reversedRangeIs409() throws Exception {
        mvc.perform(get("/api/dashboard").param("from", "2025-06").param("to", "2025-01"))
                .andExpect(status().isConflict());
    }

    @Test
    void monthsListed() throws Exception {
        when(metricsEngine.availableMonths()).thenReturn(List.of("2025-01", "2025-02"));

        mvc.perform(get("/api/dashboard/months"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[1]").value("2025-02"));
    }

    @Test
    void auditWithoutFilterReturnsRecent() throws Exception {
        when(auditLogRepository.findTop100ByOrderByIdDesc()).thenReturn(List.of());

        mvc.perform(get("/admin/audit")).andExpect(status().isOk());

        verify(auditLogRepository).findTop100ByOrderByIdDesc();
    }

    @Test
    void auditFilteredByEntity() throws Exception {
        when(auditLogRepository.findAllByEntityTypeAndEntityIdOrderByIdAsc(AuditEntityType.PROJECT, "P001"))
                .thenReturn(List.of());

        mvc.perform(get("/admin/audit").param("entityType", "PROJECT").param("entityId", "P001"))
                .andExpect(status().isOk());

        verify(auditLogRepository).findAllByEntityTypeAndEntityIdOrderByIdAsc(AuditEntityType.PROJECT, "P001");
    }
}
