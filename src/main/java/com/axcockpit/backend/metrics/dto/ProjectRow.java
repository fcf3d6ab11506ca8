package com.axcockpit.backend.metrics.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProjectRow {
    private String code;
    private String name;
    private String strategy;
    private String status;
    private String orgUnit;
}
