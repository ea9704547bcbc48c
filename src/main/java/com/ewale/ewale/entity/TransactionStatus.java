package com.ewale.ewale.entity;

public enum TransactionStatus {
    PENDING,      // Checkout issued, no final result yet
    PROCESSING,   // Provider accepted, result still in flight
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
