package com.ewale.ewale.entity;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CommissionServiceType {
    AIRTIME("airtime"),
    BUNDLE("bundle"),
    TV_BILL("tv_bill"),
    UTILITY("utility");

    private final String code;

    CommissionServiceType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
