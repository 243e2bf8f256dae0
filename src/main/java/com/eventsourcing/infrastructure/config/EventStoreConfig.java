package com.eventsourcing.infrastructure.config;

import com.eventsourcing.application.port.out.MetricsPort;
import com.eventsourcing.application.service.StudentProjector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class EventStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(EventStoreConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public StudentProjector studentProjector(AppProperties appProperties, MetricsPort metrics) {
        AppProperties.EventStore eventStore = appProperties.getEventStore();
        log.info("Event store: backend={}, unknownEventPolicy={}, duplicateCreatedPolicy={}, maxAppendAttempts={}",
            eventStore.getBackend(),
            eventStore.getUnknownEventPolicy(),
            eventStore.getDuplicateCreatedPolicy(),
            eventStore.getMaxAppendAttempts());
        return new StudentProjector(
            eventStore.getUnknownEventPolicy(),
            eventStore.getDuplicateCreatedPolicy(),
            metrics
        );
    }
}
