package com.ewale.ewale.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UssdStatisticsResponse {
    private long totalDialers;
    private long todayDialers;
    private long completedTransactions;
    private long failedTransactions;
    private String successRate; // percentage with two decimals, e.g. "87.50"
}
