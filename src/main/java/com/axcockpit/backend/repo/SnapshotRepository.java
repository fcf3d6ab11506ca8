package com.axcockpit.backend.repo;

import com.axcockpit.backend.domain.Snapshot;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface SnapshotRepository extends JpaRepository<Snapshot, Long> {

    boolean existsBySnapshotDate(LocalDate snapshotDate);

    Optional<Snapshot> findTopByOrderBySnapshotDateDesc();

    List<Snapshot> findAllByOrderBySnapshotDateDesc();
}
