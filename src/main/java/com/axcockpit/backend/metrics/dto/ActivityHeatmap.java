package com.axcockpit.backend.metrics.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 챔피언(행) × 월(열). values 는 제안+승인 원값, intensity 는 0~1 로 환산한 값.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ActivityHeatmap {
    private List<String> champions;
    private List<String> months;
    private List<List<Long>> values;
    private List<List<Double>> intensity;
    private long max;

    public long value(String champion, String month) {
        int r = champions.indexOf(champion);
        int c = months.indexOf(month);
        if (r < 0 || c < 0) return 0L;
        return values.get(r).get(c);
    }
}
