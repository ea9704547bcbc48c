package com.ewale.ewale.entity;

public enum VoucherType {
    BECE("BECE Checker Voucher"),
    WASSCE("WASSCE / Nov-Dec Checker"),
    PLACEMENT("School Placement Checker");

    private final String displayName;

    VoucherType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
