package com.zenith.backend.repository;

import com.zenith.backend.model.ThreadBinding;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ThreadBindingRepository extends JpaRepository<ThreadBinding, Long> {

    Optional<ThreadBinding> findByUserIdAndTopic(Long userId, String topic);

    @Modifying
    @Query("UPDATE ThreadBinding t SET t.initialized = true WHERE t.userId = :userId AND t.topic = :topic AND t.threadId = :threadId")
    int markInitialized(@Param("userId") Long userId, @Param("topic") String topic, @Param("threadId") String threadId);

    @Modifying
    @Query("DELETE FROM ThreadBinding t WHERE t.userId = :userId")
    int deleteByUser(@Param("userId") Long userId);

    @Modifying
    @Query("DELETE FROM ThreadBinding t")
    int deleteAllBindings();
}
