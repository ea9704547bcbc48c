package com.ewale.ewale.entity;

public enum CommissionServiceStatus {
    PENDING,
    DELIVERED,
    FAILED
}
