package com.ewale.ewale.entity;

public enum WithdrawalStatus {
    PENDING,     // Sent to Send Money, amount provisionally debited
    COMPLETED,
    FAILED       // Amount is available again
}
