package com.axcockpit.backend.reconcile;

import com.axcockpit.backend.domain.Project;
import com.axcockpit.backend.ingest.excel.MasterRow;

/**
 * 과제의 변경 가능한 필드 묶음. 편집 요청에서는 null 이 "변경 안 함"을 뜻한다.
 */
public record ProjectFields(String name,
                            String champion,
                            String strategy,
                            String status,
                            String orgUnit,
                            String proposedMonth,
                            String approvedMonth) {

    public static ProjectFields from(MasterRow row) {
        return new ProjectFields(row.name(), row.champion(), row.strategy(), row.status(),
                row.orgUnit(), row.proposedMonth(), row.approvedMonth());
    }

    /** 현재 값 위에 null 이 아닌 필드만 덮어쓴 전체 필드 */
    public ProjectFields overlayOn(Project current) {
        return new ProjectFields(
                pick(name, current.getName()),
                pick(champion, current.getChampion()),
                pick(strategy, current.getStrategy().getName()),
                pick(status, current.getStatus()),
                pick(orgUnit, current.getOrgUnit()),
                pick(proposedMonth, current.getProposedMonth()),
                pick(approvedMonth, current.getApprovedMonth()));
    }

    private static String pick(String incoming, String current) {
        return incoming != null ? incoming : current;
    }
}
