package com.ewale.ewale.entity;

public enum UtilityProvider {
    ECG("ECG Prepaid"),
    GHANA_WATER("Ghana Water");

    private final String displayName;

    UtilityProvider(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
