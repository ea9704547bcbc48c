package com.ewale.ewale.service.ussd;

import com.ewale.ewale.dto.ServiceQueryItem;
import com.ewale.ewale.entity.BuyerFlow;
import com.ewale.ewale.entity.NetworkProvider;
import com.ewale.ewale.entity.TvProvider;
import com.ewale.ewale.entity.UssdServiceType;
import com.ewale.ewale.entity.UtilityProvider;
import com.ewale.ewale.entity.VoucherType;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Working memory of one USSD session. Lives only in the {@link SessionStore}.
 */
@Data
@NoArgsConstructor
public class SessionState {

    public static final String METER_PREPAID = "prepaid";
    public static final String METER_POSTPAID = "postpaid";

    public static final String OPTION_TOPUP = "topup";
    public static final String OPTION_ADD_METER = "add_meter";
    public static final String OPTION_PAY_BILL = "pay_bill";

    public static final String SUBSCRIPTION_RENEW = "renew";
    public static final String SUBSCRIPTION_CHANGE = "change";

    public static final String EARNING_WITHDRAWAL = "withdrawal";

    private String sessionId;
    private LocalDateTime createdAt = LocalDateTime.now();

    private UssdServiceType serviceType;
    private String service; // Product display name
    private NetworkProvider network;
    private TvProvider tvProvider;
    private UtilityProvider utilityProvider;
    private BuyerFlow flow;

    private String mobile;
    private String name;
    private Integer quantity;
    private String email;

    private String accountNumber;
    private String meterNumber;
    private String meterType;
    private String utilitySubOption;
    private String subscriptionType;

    private BigDecimal amount;
    private BigDecimal totalAmount;

    // Bundle paging
    private List<BundleGroup> bundleGroups;
    private int currentGroupIndex;
    private int currentBundlePage;
    private boolean categorySelectionMode;
    private ServiceQueryItem selectedBundle;
    private String bundleValue;

    private List<ServiceQueryItem> accountInfo = new ArrayList<>();
    private List<ServiceQueryItem> meterInfo = new ArrayList<>();
    private ServiceQueryItem selectedMeter;

    private VoucherType voucherType;

    private String earningFlow;
    private BigDecimal withdrawalAmount;

    public SessionState(String sessionId) {
        this.sessionId = sessionId;
    }
}
