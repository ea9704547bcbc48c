package com.ewale.ewale.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Periodically reconciles payments that never received a Hubtel callback.
 */
@Service
public class TransactionStatusScheduler {

    private static final Logger logger = LoggerFactory.getLogger(TransactionStatusScheduler.class);

    private final TransactionStatusService transactionStatusService;

    public TransactionStatusScheduler(TransactionStatusService transactionStatusService) {
        this.transactionStatusService = transactionStatusService;
    }

    @Scheduled(fixedDelayString = "${hubtel.status.poll.interval.ms:300000}") // 5 minutes default
    public void pollPendingTransactions() {
        try {
            transactionStatusService.checkPendingTransactions();
        } catch (Exception e) {
            logger.error("Transaction status poll failed: {}", e.getMessage(), e);
        }
    }
}
