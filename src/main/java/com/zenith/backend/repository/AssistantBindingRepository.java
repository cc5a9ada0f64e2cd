package com.zenith.backend.repository;

import com.zenith.backend.model.AssistantBinding;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

@Repository
public interface AssistantBindingRepository extends JpaRepository<AssistantBinding, String> {

    @Modifying
    @Query("DELETE FROM AssistantBinding a")
    int deleteAllBindings();
}
