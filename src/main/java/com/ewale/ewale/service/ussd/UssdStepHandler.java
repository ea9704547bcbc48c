package com.ewale.ewale.service.ussd;

import com.ewale.ewale.dto.UssdRequest;
import com.ewale.ewale.dto.UssdResponse;

/**
 * One step of a USSD menu flow. Implementations mutate {@code state}; the dispatcher persists it.
 */
@FunctionalInterface
public interface UssdStepHandler {

    UssdResponse handle(UssdRequest request, SessionState state);
}
