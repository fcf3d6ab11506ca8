package com.axcockpit.backend.repo;

import com.axcockpit.backend.domain.Strategy;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface StrategyRepository extends JpaRepository<Strategy, Long> {

    Optional<Strategy> findByNameKey(String nameKey);
}
