package com.axcockpit.backend.repo;

import com.axcockpit.backend.domain.MonthlyEventRevision;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.time.LocalDate;
import java.util.List;

public interface MonthlyEventRevisionRepository extends JpaRepository<MonthlyEventRevision, Long> {

    /** asOf 이하 스냅샷에서 기록된 이력, 키별 최신값을 고르기 쉽도록 오래된 순 */
    @Query("""
           select r from MonthlyEventRevision r
           where r.snapshotDate <= :asOf
           order by r.snapshotDate asc, r.id asc
           """)
    List<MonthlyEventRevision> findAllUpTo(LocalDate asOf);

    List<MonthlyEventRevision> findAllByProjectCodeOrderByIdAsc(String projectCode);
}
