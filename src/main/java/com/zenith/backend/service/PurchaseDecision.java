package com.zenith.backend.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.zenith.backend.model.TransactionStatus;

import java.math.BigDecimal;

/**
 * Outcome of a purchase evaluation. {@code newBalance} is only set when the purchase was allowed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PurchaseDecision(TransactionStatus status, String reason, BigDecimal newBalance, Long transactionId) {
}
