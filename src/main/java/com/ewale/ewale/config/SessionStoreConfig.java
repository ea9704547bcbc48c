package com.ewale.ewale.config;

import com.ewale.ewale.service.ussd.CaffeineSessionStore;
import com.ewale.ewale.service.ussd.InMemorySessionStore;
import com.ewale.ewale.service.ussd.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class SessionStoreConfig {

    private static final Logger logger = LoggerFactory.getLogger(SessionStoreConfig.class);

    @Value("${ussd.session.store:memory}")
    private String storeType;

    @Value("${ussd.session.ttl-minutes:0}")
    private long ttlMinutes;

    @Value("${ussd.session.maximum-size:100000}")
    private long maximumSize;

    @Bean
    public SessionStore sessionStore() {
        if ("caffeine".equalsIgnoreCase(storeType)) {
            logger.info("USSD sessions: Caffeine store, max {} entries, idle timeout {} min (0 = none)",
                    maximumSize, ttlMinutes);
            return new CaffeineSessionStore(maximumSize, Duration.ofMinutes(Math.max(ttlMinutes, 0)));
        }
        logger.info("USSD sessions: in-memory store without expiry");
        return new InMemorySessionStore();
    }
}
