package com.ewale.ewale.service;

import com.ewale.ewale.dto.UssdRequest;
import com.ewale.ewale.dto.UssdResponse;
import com.ewale.ewale.entity.UssdLog;
import com.ewale.ewale.service.ussd.SessionState;
import com.ewale.ewale.service.ussd.SessionStore;
import com.ewale.ewale.service.ussd.UssdResponseBuilder;
import com.ewale.ewale.service.ussd.UssdRoutingTable;
import com.ewale.ewale.service.ussd.UssdStepHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Entry point for every USSD turn. Loads the session, routes the turn to its step handler and
 * owns the session lifecycle: a release always removes the session, a checkout keeps it for the
 * payment callback.
 */
@Service
public class UssdService {

    private static final Logger logger = LoggerFactory.getLogger(UssdService.class);

    private final SessionStore sessionStore;
    private final UssdRoutingTable routingTable;
    private final UssdResponseBuilder responses;
    private final UssdLoggingService loggingService;

    public UssdService(SessionStore sessionStore, UssdRoutingTable routingTable, UssdResponseBuilder responses,
                       UssdLoggingService loggingService) {
        this.sessionStore = sessionStore;
        this.routingTable = routingTable;
        this.responses = responses;
        this.loggingService = loggingService;
    }

    public UssdResponse handleUssdRequest(UssdRequest request) {
        String type = request.getType() == null ? "" : request.getType().toLowerCase();
        switch (type) {
            case UssdRequest.TYPE_INITIATION:
                return initiate(request);
            case UssdRequest.TYPE_RESPONSE:
                return continueSession(request);
            default:
                logger.info("Session {} ended by gateway with type {}", request.getSessionId(), request.getType());
                sessionStore.delete(request.getSessionId());
                return responses.thankYou(request.getSessionId());
        }
    }

    private UssdResponse initiate(UssdRequest request) {
        SessionState state = sessionStore.create(request.getSessionId());
        logger.info("USSD session {} initiated by {}", request.getSessionId(), request.getMobile());
        loggingService.logSessionState(request.getSessionId(), request.getMobile(), request.getSequence(),
                request.getMessage(), state, UssdLog.STATUS_INITIATED);
        return responses.mainMenu(request.getSessionId());
    }

    private UssdResponse continueSession(UssdRequest request) {
        String sessionId = request.getSessionId();
        Optional<SessionState> existing = sessionStore.get(sessionId);
        if (existing.isEmpty()) {
            logger.warn("No session found for {}", sessionId);
            return responses.error(sessionId, UssdResponseBuilder.SESSION_EXPIRED);
        }
        SessionState state = existing.get();

        Optional<UssdStepHandler> handler = request.getSequence() == null
                ? Optional.empty()
                : routingTable.resolve(request.getSequence(), state);
        if (handler.isEmpty()) {
            logger.info("No step for session {} at sequence {} (service {})",
                    sessionId, request.getSequence(), state.getServiceType());
            sessionStore.delete(sessionId);
            return responses.thankYou(sessionId);
        }

        UssdResponse response;
        try {
            response = handler.get().handle(request, state);
        } catch (RuntimeException e) {
            logger.error("Error handling USSD turn {} for session {}", request.getSequence(), sessionId, e);
            loggingService.markFailed(sessionId, e.getMessage());
            sessionStore.delete(sessionId);
            return responses.error(sessionId, UssdResponseBuilder.GENERIC_ERROR);
        }

        if (response.isRelease()) {
            sessionStore.delete(sessionId);
            if ("Error".equals(response.getLabel())) {
                loggingService.markFailed(sessionId, response.getMessage());
            }
            return response;
        }

        sessionStore.update(sessionId, state);
        loggingService.logSessionState(sessionId, request.getMobile(), request.getSequence(), request.getMessage(),
                state, UssdLog.STATUS_ACTIVE);
        return response;
    }
}
