package com.ewale.ewale.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CheckoutItem {
    @JsonProperty("ItemName")
    private String itemName;

    @JsonProperty("Qty")
    private Integer qty;

    @JsonProperty("Price")
    private BigDecimal price;
}
