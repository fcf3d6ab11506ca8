package com.axcockpit.backend.api;

import com.axcockpit.backend.metrics.MetricsEngine;
import com.axcockpit.backend.metrics.MetricsWindow;
import com.axcockpit.backend.metrics.dto.DashboardMetrics;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/dashboard")
@RequiredArgsConstructor
public class DashboardController {

    private final MetricsEngine metricsEngine;

    /**
     * month 하나 또는 from~to 구간. 아무것도 없으면 전체 월.
     * asOf 를 주면 그 날짜 스냅샷까지 반영된 상태로 계산
     */
    @GetMapping
    public DashboardMetrics dashboard(@RequestParam(required = false) String month,
                                      @RequestParam(required = false) String from,
                                      @RequestParam(required = false) String to,
                                      @RequestParam(required = false)
                                      @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {
        MetricsWindow window = month != null ? MetricsWindow.single(month) : MetricsWindow.range(from, to);
        if (asOf != null) window = window.asOf(asOf);
        return metricsEngine.computeMetrics(window);
    }

    @GetMapping("/months")
    public List<String> months() {
        return metricsEngine.availableMonths();
    }
}
