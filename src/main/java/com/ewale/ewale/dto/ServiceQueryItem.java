package com.ewale.ewale.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * One entry of a Commission Services catalogue query: a bundle, an account attribute or a meter.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ServiceQueryItem {
    @JsonProperty("Display")
    private String display;

    @JsonProperty("Value")
    private String value;

    @JsonProperty("Amount")
    private BigDecimal amount;
}
