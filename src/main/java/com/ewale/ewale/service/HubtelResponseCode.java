package com.ewale.ewale.service;

import com.ewale.ewale.dto.TransactionStatusResponse;
import com.ewale.ewale.dto.TransactionStatusSummary;
import com.ewale.ewale.entity.PaymentStatus;

/**
 * Hubtel response codes and their classification. {@link #classify} is a pure function of its inputs.
 */
public enum HubtelResponseCode {

    SUCCESS("0000", PaymentStatus.PAID, false, "Success"),
    PENDING("0001", PaymentStatus.PENDING, true, "Transaction is pending. Please check again later."),
    HTTP_FAILURE("0005", PaymentStatus.FAILED, false, "Transaction state is unknown. Please contact support."),
    GENERAL_FAILURE("2000", PaymentStatus.FAILED, false, "General failure occurred"),
    GENERAL_FAILURE_2("2001", PaymentStatus.FAILED, false, "General failure occurred"),
    ERROR_RETRY("4000", PaymentStatus.FAILED, true, "An error occurred. Please try again later."),
    VALIDATION_ERROR("4010", PaymentStatus.FAILED, false, "Validation error. Please check your parameters."),
    AUTH_DENIED("4101", PaymentStatus.FAILED, false, "Authorization denied. Please check your API credentials."),
    PERMISSION_DENIED("4103", PaymentStatus.FAILED, false, "Permission denied. Please check your API permissions."),
    INSUFFICIENT_BALANCE("4075", PaymentStatus.FAILED, false, "Insufficient prepaid balance.");

    private final String code;
    private final PaymentStatus status;
    private final boolean retryable;
    private final String defaultMessage;

    HubtelResponseCode(String code, PaymentStatus status, boolean retryable, String defaultMessage) {
        this.code = code;
        this.status = status;
        this.retryable = retryable;
        this.defaultMessage = defaultMessage;
    }

    public String getCode() {
        return code;
    }

    public PaymentStatus getStatus() {
        return status;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public static HubtelResponseCode fromCode(String code) {
        for (HubtelResponseCode value : values()) {
            if (value.code.equals(code)) {
                return value;
            }
        }
        return null;
    }

    public static TransactionStatusSummary classify(TransactionStatusResponse response) {
        if (response == null) {
            return classify(null, null, null);
        }
        TransactionStatusSummary summary = classify(response.getResponseCode(),
                response.getData() != null ? response.getData().getStatus() : null,
                response.getMessage());
        summary.setData(response.getData());
        return summary;
    }

    /**
     * @param code       Hubtel response code
     * @param dataStatus {@code data.status} of a status query (Paid/Unpaid), may be null
     * @param message    description returned by Hubtel, used for general failures
     */
    public static TransactionStatusSummary classify(String code, String dataStatus, String message) {
        HubtelResponseCode known = fromCode(code);
        if (known == null) {
            return new TransactionStatusSummary(code, false, PaymentStatus.FAILED, false,
                    "Unknown response code: " + code, null);
        }
        switch (known) {
            case SUCCESS:
                PaymentStatus paid = PaymentStatus.UNPAID.getLabel().equalsIgnoreCase(dataStatus)
                        ? PaymentStatus.UNPAID : PaymentStatus.PAID;
                String label = dataStatus != null ? dataStatus.toLowerCase() : "paid";
                return new TransactionStatusSummary(code, true, paid, false, "Transaction " + label, null);
            case GENERAL_FAILURE:
            case GENERAL_FAILURE_2:
                return new TransactionStatusSummary(code, false, known.status, known.retryable,
                        message != null && !message.isBlank() ? message : known.defaultMessage, null);
            default:
                return new TransactionStatusSummary(code, false, known.status, known.retryable,
                        known.defaultMessage, null);
        }
    }
}
