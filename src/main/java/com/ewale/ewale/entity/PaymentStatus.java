package com.ewale.ewale.entity;

/**
 * Payment state as reported by the Hubtel transaction status API.
 */
public enum PaymentStatus {
    PAID("Paid"),
    UNPAID("Unpaid"),
    PENDING("Pending"),
    FAILED("Failed");

    private final String label;

    PaymentStatus(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static PaymentStatus fromLabel(String label) {
        for (PaymentStatus status : values()) {
            if (status.label.equalsIgnoreCase(label)) {
                return status;
            }
        }
        return null;
    }
}
