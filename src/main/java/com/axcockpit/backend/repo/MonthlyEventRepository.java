package com.axcockpit.backend.repo;

import com.axcockpit.backend.domain.MonthlyEvent;
import com.axcockpit.backend.domain.Project;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface MonthlyEventRepository extends JpaRepository<MonthlyEvent, Long> {

    Optional<MonthlyEvent> findByProjectAndMonthKeyAndKind(
            Project project,
            String monthKey,
            MonthlyEvent.Kind kind
    );

    @Query("""
           select e from MonthlyEvent e
           where e.project.code = :projectCode
             and e.monthKey = :monthKey
             and e.kind = :kind
           """)
    Optional<MonthlyEvent> findByProjectCodeAndMonthKeyAndKind(
            String projectCode,
            String monthKey,
            MonthlyEvent.Kind kind
    );

    /** 적재 대상 월들의 기존 이벤트를 한 번에 조회 */
    List<MonthlyEvent> findAllByMonthKeyIn(Collection<String> monthKeys);

    @Query("select distinct e.monthKey from MonthlyEvent e order by e.monthKey")
    List<String> findDistinctMonthKeys();
}
