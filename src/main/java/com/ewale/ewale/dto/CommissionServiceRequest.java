package com.ewale.ewale.dto;

import com.ewale.ewale.entity.CommissionServiceType;
import com.ewale.ewale.entity.NetworkProvider;
import com.ewale.ewale.entity.TvProvider;
import com.ewale.ewale.entity.UtilityProvider;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;

/**
 * Delivery order for Hubtel Commission Services, built once after a successful payment.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CommissionServiceRequest {
    private String clientReference;
    private BigDecimal amount;
    private String callbackUrl;
    private CommissionServiceType serviceType;
    private NetworkProvider network;
    private String destination;
    private TvProvider tvProvider;
    private UtilityProvider utilityProvider;
    private Map<String, Object> extraData = new HashMap<>();
}
