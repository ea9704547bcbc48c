package com.ewale.ewale.entity;

public enum TvProvider {
    DSTV("DSTV"),
    GOTV("GoTV"),
    STARTIMES("StarTimes TV");

    private final String displayName;

    TvProvider(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
