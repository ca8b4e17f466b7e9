package com.civicdesk.query;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

import com.civicdesk.query.config.EngineProperties;

/**
 * Spring Boot entry point for the CivicDesk query engine.
 *
 * <p>The application follows customer queries through their lifecycle, routes
 * them to staff and serves live query lists and analytics to the admin portal
 * over a reactive API.</p>
 */
@SpringBootApplication
@EnableConfigurationProperties(EngineProperties.class)
public class QueryEngineApp {

    public static void main(String[] args) {
        SpringApplication.run(QueryEngineApp.class, args);
    }
}
