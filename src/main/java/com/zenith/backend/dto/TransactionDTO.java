package com.zenith.backend.dto;

import com.zenith.backend.model.LedgerTransaction;
import com.zenith.backend.model.TransactionStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransactionDTO {
    private Long id;
    private String itemName;
    private BigDecimal amount;
    private TransactionStatus status;
    private String reason;
    private LocalDateTime createdAt;

    public static TransactionDTO from(LedgerTransaction transaction) {
        return TransactionDTO.builder()
                .id(transaction.getId())
                .itemName(transaction.getItemName())
                .amount(transaction.getAmount())
                .status(transaction.getStatus())
                .reason(transaction.getReason())
                .createdAt(transaction.getCreatedAt())
                .build();
    }
}
