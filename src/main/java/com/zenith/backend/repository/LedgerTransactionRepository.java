package com.zenith.backend.repository;

import com.zenith.backend.model.LedgerTransaction;
import com.zenith.backend.model.TransactionStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface LedgerTransactionRepository extends JpaRepository<LedgerTransaction, Long> {

    List<LedgerTransaction> findByUserIdOrderByCreatedAtDescIdDesc(Long userId);

    List<LedgerTransaction> findByUserIdOrderByCreatedAtDescIdDesc(Long userId, Pageable pageable);

    long countByUserIdAndStatus(Long userId, TransactionStatus status);
}
