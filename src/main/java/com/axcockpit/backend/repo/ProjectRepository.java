package com.axcockpit.backend.repo;

import com.axcockpit.backend.domain.Project;
import com.axcockpit.backend.domain.Strategy;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface ProjectRepository extends JpaRepository<Project, Long> {

    Optional<Project> findByCode(String code);

    /** 벌크로 존재여부 확인 */
    List<Project> findAllByCodeIn(Collection<String> codes);

    List<Project> findAllByOrderByCodeAsc();

    boolean existsByStrategy(Strategy strategy);
}
