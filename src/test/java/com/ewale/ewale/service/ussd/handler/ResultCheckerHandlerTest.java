package com.ewale.ewale.service.ussd.handler;

import com.ewale.ewale.dto.UssdRequest;
import com.ewale.ewale.dto.UssdResponse;
import com.ewale.ewale.entity.BuyerFlow;
import com.ewale.ewale.entity.UssdServiceType;
import com.ewale.ewale.entity.VoucherType;
import com.ewale.ewale.service.PaymentRequestService;
import com.ewale.ewale.service.ussd.SessionState;
import com.ewale.ewale.service.ussd.UssdResponseBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(MockitoExtension.class)
@DisplayName("ResultCheckerHandler Unit Tests")
class ResultCheckerHandlerTest {

    private static final String SESSION_ID = "S1";

    @Mock
    private PaymentRequestService paymentRequestService;

    private ResultCheckerHandler resultCheckerHandler;
    private SessionState state;

    @BeforeEach
    void setUp() {
        resultCheckerHandler = new ResultCheckerHandler(new UssdResponseBuilder(), paymentRequestService);
        state = new SessionState(SESSION_ID);
        state.setServiceType(UssdServiceType.RESULT_CHECKER);
    }

    private static UssdRequest input(String message) {
        UssdRequest request = new UssdRequest();
        request.setSessionId(SESSION_ID);
        request.setMobile("233550982043");
        request.setMessage(message);
        return request;
    }

    @Test
    @DisplayName("BECE vouchers for self are priced at 20 each")
    void beceForSelf() {
        // When
        resultCheckerHandler.selectVoucherType(input("1"), state);
        resultCheckerHandler.selectBuyerFlow(input("1"), state);
        UssdResponse response = resultCheckerHandler.enterQuantity(input("3"), state);

        // Then
        assertThat(state.getVoucherType()).isEqualTo(VoucherType.BECE);
        assertThat(state.getMobile()).isEqualTo("233550982043");
        assertThat(state.getTotalAmount()).isEqualByComparingTo("60");
        assertThat(response.getLabel()).isEqualTo("Order Details");
        assertThat(response.getMessage()).contains("Bought For: Self").contains("Quantity: 3");
    }

    @Test
    @DisplayName("WASSCE vouchers for another number show the local recipient")
    void wassceForOther() {
        // When
        resultCheckerHandler.selectVoucherType(input("2"), state);
        resultCheckerHandler.selectBuyerFlow(input("2"), state);
        resultCheckerHandler.enterRecipientMobile(input("0244000111"), state);
        resultCheckerHandler.enterRecipientName(input("Yaw"), state);
        UssdResponse response = resultCheckerHandler.enterQuantity(input("2"), state);

        // Then
        assertThat(state.getFlow()).isEqualTo(BuyerFlow.OTHER);
        assertThat(state.getName()).isEqualTo("Yaw");
        assertThat(state.getTotalAmount()).isEqualByComparingTo("42");
        assertThat(response.getMessage()).contains("Bought For: 0244000111");
    }

    @Test
    @DisplayName("Quantity must be between 1 and 80")
    void quantityBounds() {
        state.setVoucherType(VoucherType.BECE);

        assertThat(resultCheckerHandler.enterQuantity(input("0"), state).getLabel()).isEqualTo("Error");
        assertThat(resultCheckerHandler.enterQuantity(input("81"), state).getLabel()).isEqualTo("Error");
        assertThat(resultCheckerHandler.enterQuantity(input("80"), state).getLabel()).isEqualTo("Order Details");
    }

    @Test
    @DisplayName("One-letter name is rejected")
    void shortName() {
        assertThat(resultCheckerHandler.enterRecipientName(input("Y"), state).getMessage())
                .isEqualTo("Please enter a valid name (minimum 2 characters)");
    }
}
