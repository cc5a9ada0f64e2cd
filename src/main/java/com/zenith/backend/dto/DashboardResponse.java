package com.zenith.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DashboardResponse {
    private String username;
    private BigDecimal balance;
    private Integer stressLevel;
    private List<TransactionDTO> recentTransactions;
    private String insight;
}
