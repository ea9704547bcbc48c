package com.ewale.ewale.entity;

public enum NetworkProvider {
    MTN("MTN"),
    TELECEL("Telecel Ghana"),
    AT("AT");

    private final String displayName;

    NetworkProvider(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
