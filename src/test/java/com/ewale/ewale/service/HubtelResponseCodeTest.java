package com.ewale.ewale.service;

import com.ewale.ewale.dto.TransactionStatusResponse;
import com.ewale.ewale.dto.TransactionStatusSummary;
import com.ewale.ewale.entity.PaymentStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("HubtelResponseCode classification")
class HubtelResponseCodeTest {

    @Test
    @DisplayName("0000 with Paid data is a successful payment")
    void successPaid() {
        TransactionStatusSummary summary = HubtelResponseCode.classify("0000", "Paid", null);

        assertThat(summary.isSuccessful()).isTrue();
        assertThat(summary.getStatus()).isEqualTo(PaymentStatus.PAID);
        assertThat(summary.isShouldRetry()).isFalse();
        assertThat(summary.getMessage()).isEqualTo("Transaction paid");
    }

    @Test
    @DisplayName("0000 with Unpaid data is a successful query of an unpaid transaction")
    void successUnpaid() {
        TransactionStatusSummary summary = HubtelResponseCode.classify("0000", "Unpaid", null);

        assertThat(summary.isSuccessful()).isTrue();
        assertThat(summary.getStatus()).isEqualTo(PaymentStatus.UNPAID);
    }

    @Test
    @DisplayName("0001 is pending and retryable")
    void pending() {
        TransactionStatusSummary summary = HubtelResponseCode.classify("0001", null, null);

        assertThat(summary.isSuccessful()).isFalse();
        assertThat(summary.getStatus()).isEqualTo(PaymentStatus.PENDING);
        assertThat(summary.isShouldRetry()).isTrue();
    }

    @Test
    @DisplayName("2001 carries Hubtel's own description")
    void generalFailureUsesMessage() {
        TransactionStatusSummary summary = HubtelResponseCode.classify("2001", null, "Payer declined");

        assertThat(summary.getStatus()).isEqualTo(PaymentStatus.FAILED);
        assertThat(summary.isShouldRetry()).isFalse();
        assertThat(summary.getMessage()).isEqualTo("Payer declined");
    }

    @Test
    @DisplayName("2000 without a description falls back to the default message")
    void generalFailureDefault() {
        assertThat(HubtelResponseCode.classify("2000", null, " ").getMessage())
                .isEqualTo("General failure occurred");
    }

    @Test
    @DisplayName("4000 is a retryable failure")
    void errorRetry() {
        TransactionStatusSummary summary = HubtelResponseCode.classify("4000", null, null);

        assertThat(summary.getStatus()).isEqualTo(PaymentStatus.FAILED);
        assertThat(summary.isShouldRetry()).isTrue();
    }

    @Test
    @DisplayName("Credential errors are permanent failures")
    void authDenied() {
        TransactionStatusSummary summary = HubtelResponseCode.classify("4101", null, null);

        assertThat(summary.getStatus()).isEqualTo(PaymentStatus.FAILED);
        assertThat(summary.isShouldRetry()).isFalse();
    }

    @Test
    @DisplayName("Unknown code fails without retry and names the code")
    void unknownCode() {
        TransactionStatusSummary summary = HubtelResponseCode.classify("9999", null, null);

        assertThat(summary.getStatus()).isEqualTo(PaymentStatus.FAILED);
        assertThat(summary.isShouldRetry()).isFalse();
        assertThat(summary.getMessage()).isEqualTo("Unknown response code: 9999");
    }

    @Test
    @DisplayName("Status response keeps its data on the summary")
    void classifyResponse() {
        TransactionStatusResponse.StatusData data = new TransactionStatusResponse.StatusData();
        data.setStatus("Paid");
        data.setClientReference("ORD-1");
        TransactionStatusResponse response = new TransactionStatusResponse("Successful", "0000", data);

        TransactionStatusSummary summary = HubtelResponseCode.classify(response);

        assertThat(summary.getStatus()).isEqualTo(PaymentStatus.PAID);
        assertThat(summary.getData().getClientReference()).isEqualTo("ORD-1");
    }
}
