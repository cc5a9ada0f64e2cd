package com.zenith.backend.repository;

import com.zenith.backend.model.CachedBrief;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface CachedBriefRepository extends JpaRepository<CachedBrief, Long> {

    Optional<CachedBrief> findByUserIdAndTopic(Long userId, String topic);

    @Modifying
    @Query("DELETE FROM CachedBrief b WHERE b.userId = :userId")
    int deleteByUser(@Param("userId") Long userId);

    @Modifying
    @Query("DELETE FROM CachedBrief b")
    int deleteAllBriefs();
}
