package com.zenith.backend.repository;

import com.zenith.backend.model.StressLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface StressLogRepository extends JpaRepository<StressLog, Long> {

    List<StressLog> findByUserIdOrderByLogDateDescIdDesc(Long userId);
}
