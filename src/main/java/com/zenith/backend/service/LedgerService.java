package com.zenith.backend.service;

import com.zenith.backend.dto.TransactionDTO;
import com.zenith.backend.repository.LedgerTransactionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class LedgerService {

    private final LedgerTransactionRepository transactionRepository;

    @Transactional(readOnly = true)
    public List<TransactionDTO> history(Long userId) {
        return transactionRepository.findByUserIdOrderByCreatedAtDescIdDesc(userId).stream()
                .map(TransactionDTO::from)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<TransactionDTO> recent(Long userId, int limit) {
        return transactionRepository.findByUserIdOrderByCreatedAtDescIdDesc(userId, PageRequest.of(0, limit)).stream()
                .map(TransactionDTO::from)
                .collect(Collectors.toList());
    }
}
