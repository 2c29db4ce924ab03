package com.labelloop.core.config;

import com.labelloop.core.engine.EventPublishingManualReviewGateway;
import com.labelloop.core.engine.ManualReviewGateway;
import com.labelloop.core.events.EventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    /** Single time source for priorities, timeouts and timestamps. */
    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock labelLoopClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(ManualReviewGateway.class)
    public ManualReviewGateway manualReviewGateway(EventBus eventBus) {
        log.info("No ManualReviewGateway configured, announcing manual reviews on the event bus");
        return new EventPublishingManualReviewGateway(eventBus);
    }
}
