package com.civicdesk.query.config;

import java.time.Clock;
import java.time.ZoneId;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.civicdesk.query.repository.QueryEntityRepository;

/**
 * Miscellaneous application-wide beans that don't belong in specific features
 * (time source, day-boundary zone, startup probe).
 */
@Configuration
public class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ZoneId engineZone(EngineProperties properties) {
        return properties.zoneId();
    }

    /**
     * Performs a lightweight startup check by counting stored queries. This gives
     * operators a hint that the database connection is alive before any traffic hits
     * the service.
     */
    @Bean
    public ApplicationRunner databaseProbe(QueryEntityRepository repository) {
        return args -> repository.count()
            .subscribe(
                count -> log.info("Query engine started. Stored query count: {}", count),
                error -> log.warn("Query store probe failed: {}", error.getMessage()));
    }
}
