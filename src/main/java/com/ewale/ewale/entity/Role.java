package com.ewale.ewale.entity;

public enum Role {
    ADMIN,
    SUPPORT
}
