package org.jouca.live_arrivals;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main Spring Boot application class of the live arrivals service.
 *
 * <p>The service answers requests for real-time arrivals at transit stops by aggregating the
 * SIRI stop-monitoring service and a GTFS-RT delta feed, enriched from a static GTFS schedule.
 * Nothing runs in the background: every fetch is triggered by a request.
 *
 * @author Jouca
 * @since 1.0
 *
 * @see org.jouca.live_arrivals.config.AggregatorConfig
 */
@SpringBootApplication
public class LiveArrivalsApplication {

    /**
     * Main entry point for the Spring Boot application.
     *
     * @param args command-line arguments passed to the application
     */
    public static void main(String[] args) {
        SpringApplication.run(LiveArrivalsApplication.class, args);
    }
}
