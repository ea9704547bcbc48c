package com.ewale.ewale.service;

import com.ewale.ewale.dto.TransactionStatusResponse;
import com.ewale.ewale.dto.TransactionStatusSummary;
import com.ewale.ewale.entity.PaymentTransaction;
import com.ewale.ewale.entity.TransactionStatus;
import com.ewale.ewale.exception.HubtelApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Hubtel transaction status API and reconciliation of transactions that never got a callback.
 * Reconciliation only updates records; it never triggers fulfilment.
 */
@Service
public class TransactionStatusService {

    private static final Logger logger = LoggerFactory.getLogger(TransactionStatusService.class);

    private final RestTemplate restTemplate;
    private final TransactionLedgerService ledgerService;
    private final UssdLoggingService ussdLoggingService;
    private final CommissionTransactionLogService commissionLogService;

    @Value("${hubtel.status.base-url:https://api-txnstatus.hubtel.com}")
    private String statusBaseUrl;

    @Value("${hubtel.pos-sales-id:11684}")
    private String posSalesId;

    @Value("${hubtel.auth-token:}")
    private String authToken;

    @Value("${hubtel.status.poll.older-than-minutes:5}")
    private long olderThanMinutes;

    @Value("${hubtel.status.poll.batch-size:5}")
    private int batchSize;

    @Value("${hubtel.status.poll.batch-pause-ms:1000}")
    private long batchPauseMs;

    public TransactionStatusService(RestTemplate restTemplate, TransactionLedgerService ledgerService,
                                    UssdLoggingService ussdLoggingService,
                                    CommissionTransactionLogService commissionLogService) {
        this.restTemplate = restTemplate;
        this.ledgerService = ledgerService;
        this.ussdLoggingService = ussdLoggingService;
        this.commissionLogService = commissionLogService;
    }

    /**
     * Queries the status API. At least one identifier is required.
     *
     * @throws IllegalArgumentException when every identifier is blank
     * @throws HubtelApiException       when the API cannot be reached or returns an HTTP error
     */
    public TransactionStatusSummary checkTransactionStatus(String clientReference, String hubtelTransactionId,
                                                           String networkTransactionId) {
        if (isBlank(clientReference) && isBlank(hubtelTransactionId) && isBlank(networkTransactionId)) {
            throw new IllegalArgumentException("At least one transaction identifier must be provided");
        }

        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(statusBaseUrl)
                .pathSegment("transactions", posSalesId, "status");
        if (!isBlank(clientReference)) {
            builder.queryParam("clientReference", clientReference);
        }
        if (!isBlank(hubtelTransactionId)) {
            builder.queryParam("hubtelTransactionId", hubtelTransactionId);
        }
        if (!isBlank(networkTransactionId)) {
            builder.queryParam("networkTransactionId", networkTransactionId);
        }
        URI uri = builder.encode().build().toUri();

        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.set(HttpHeaders.AUTHORIZATION, "Basic " + authToken);

        logger.info("Checking transaction status: {}", uri);
        try {
            ResponseEntity<TransactionStatusResponse> response = restTemplate.exchange(
                    uri, HttpMethod.GET, new HttpEntity<>(headers), TransactionStatusResponse.class);
            TransactionStatusSummary summary = HubtelResponseCode.classify(response.getBody());
            logger.info("Transaction status for {}: {} ({})", clientReference, summary.getStatus(), summary.getResponseCode());
            return summary;
        } catch (HttpStatusCodeException e) {
            logger.error("Status API HTTP error: {} - {}", e.getStatusCode(), e.getResponseBodyAsString());
            throw new HubtelApiException("Status check failed: " + e.getStatusCode(), e);
        } catch (Exception e) {
            logger.error("Error checking transaction status: {}", e.getMessage());
            throw new HubtelApiException("Status check failed: " + e.getMessage(), e);
        }
    }

    /**
     * Checks every PENDING or PROCESSING transaction older than the configured age, in batches.
     *
     * @return number of transactions that reached a final status
     */
    public int checkPendingTransactions() {
        List<PaymentTransaction> pending = ledgerService.findPendingOlderThan(
                LocalDateTime.now().minusMinutes(olderThanMinutes));
        if (pending.isEmpty()) {
            logger.debug("No pending transactions older than {} minutes", olderThanMinutes);
            return 0;
        }
        logger.info("Checking status of {} pending transaction(s)", pending.size());

        int resolved = 0;
        int size = Math.max(1, batchSize);
        for (int i = 0; i < pending.size(); i += size) {
            for (PaymentTransaction transaction : pending.subList(i, Math.min(i + size, pending.size()))) {
                if (reconcile(transaction)) {
                    resolved++;
                }
            }
            if (i + size < pending.size() && batchPauseMs > 0) {
                try {
                    Thread.sleep(batchPauseMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    logger.warn("Status check interrupted after {} transaction(s)", i + size);
                    break;
                }
            }
        }
        if (resolved > 0) {
            logger.info("Resolved {} pending transaction(s)", resolved);
        }
        return resolved;
    }

    boolean reconcile(PaymentTransaction transaction) {
        String reference = transaction.getOrderId() != null ? transaction.getOrderId() : transaction.getClientReference();
        try {
            TransactionStatusSummary summary = checkTransactionStatus(reference, null, null);
            TransactionStatus status = ledgerService.applyStatusCheck(transaction, summary);
            if (status == TransactionStatus.COMPLETED) {
                ussdLoggingService.markCompleted(transaction.getSessionId());
            } else if (status == TransactionStatus.FAILED) {
                ussdLoggingService.markFailed(transaction.getSessionId(), summary.getMessage());
            }
            if (transaction.getOrderId() != null) {
                commissionLogService.applyStatusCheck(transaction.getOrderId(), summary);
            }
            return status.isTerminal();
        } catch (RuntimeException e) {
            logger.warn("Status check for {} failed: {}", reference, e.getMessage());
            return false;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
