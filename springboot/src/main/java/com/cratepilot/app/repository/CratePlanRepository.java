package com.cratepilot.app.repository;

import com.cratepilot.app.entity.CratePlan;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CratePlanRepository extends JpaRepository<CratePlan, Long> {

    List<CratePlan> findTop20ByOrderByCreatedAtDesc();
}
