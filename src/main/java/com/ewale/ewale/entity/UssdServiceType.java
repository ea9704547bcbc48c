package com.ewale.ewale.entity;

public enum UssdServiceType {
    AIRTIME_TOPUP("airtime_topup"),
    DATA_BUNDLE("data_bundle"),
    PAY_BILLS("pay_bills"),
    UTILITY_SERVICE("utility_service"),
    RESULT_CHECKER("result_checker"),
    EARNING("earning");

    private final String code;

    UssdServiceType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
