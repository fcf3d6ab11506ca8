package com.axcockpit.backend.metrics;

/** 챔피언 순위 1차 정렬 기준. 나머지 하나가 2차 기준이 된다. */
public enum RankingMetric {
    PROPOSALS,
    APPROVALS;

    public RankingMetric other() {
        return this == PROPOSALS ? APPROVALS : PROPOSALS;
    }
}
