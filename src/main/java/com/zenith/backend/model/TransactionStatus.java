package com.zenith.backend.model;

public enum TransactionStatus {
    ALLOWED,
    BLOCKED,
    INCOME
}
