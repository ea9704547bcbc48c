package com.ewale.ewale.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Checkout result posted by Hubtel once the subscriber approved or declined the mobile money prompt.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PaymentCallbackRequest {

    @NotBlank(message = "SessionId is required")
    @JsonProperty("SessionId")
    private String sessionId;

    @NotBlank(message = "OrderId is required")
    @JsonProperty("OrderId")
    private String orderId;

    @JsonProperty("ExtraData")
    private Map<String, Object> extraData;

    @NotNull(message = "OrderInfo is required")
    @Valid
    @JsonProperty("OrderInfo")
    private OrderInfo orderInfo;

    @JsonIgnore
    public boolean isSuccessful() {
        return orderInfo != null
                && orderInfo.getPayment() != null
                && Boolean.TRUE.equals(orderInfo.getPayment().getIsSuccessful());
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class OrderInfo {
        @JsonProperty("CustomerMobileNumber")
        private String customerMobileNumber;

        @JsonProperty("CustomerEmail")
        private String customerEmail;

        @JsonProperty("CustomerName")
        private String customerName;

        @JsonProperty("Status")
        private String status;

        @JsonProperty("OrderDate")
        private String orderDate;

        @JsonProperty("Currency")
        private String currency;

        @JsonProperty("BranchName")
        private String branchName;

        @JsonProperty("IsRecurring")
        private Boolean isRecurring;

        @JsonProperty("RecurringInvoiceId")
        private String recurringInvoiceId;

        @JsonProperty("Subtotal")
        private BigDecimal subtotal;

        @JsonProperty("Items")
        private List<Item> items;

        @NotNull(message = "Payment is required")
        @JsonProperty("Payment")
        private Payment payment;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Item {
        @JsonProperty("ItemId")
        private String itemId;

        @JsonProperty("Name")
        private String name;

        @JsonProperty("Quantity")
        private Integer quantity;

        @JsonProperty("UnitPrice")
        private BigDecimal unitPrice;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Payment {
        @JsonProperty("PaymentType")
        private String paymentType;

        @JsonProperty("AmountPaid")
        private BigDecimal amountPaid;

        @JsonProperty("AmountAfterCharges")
        private BigDecimal amountAfterCharges;

        @JsonProperty("PaymentDate")
        private String paymentDate;

        @JsonProperty("PaymentDescription")
        private String paymentDescription;

        @JsonProperty("IsSuccessful")
        private Boolean isSuccessful;
    }
}
