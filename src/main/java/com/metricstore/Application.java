package com.metricstore;

import com.metricstore.config.StoreConfig;
import com.metricstore.storage.TimeSeriesStore;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

/**
 * Main Spring Boot application for the telemetry metric store.
 *
 * Hosts an in-process time-series store for per-entity metrics such as car speed,
 * position and tire or engine telemetry.
 *
 * Features:
 * - Tagged, timestamped numeric points grouped into series by measurement and tags
 * - Bounded memory through a per-series point cap and a retention window
 * - Lossy compaction of points that carry no significant change
 * - Range queries and avg/sum/min/max/count aggregation, optionally grouped by a tag
 * - Periodic JSON snapshots restored at startup
 */
@SpringBootApplication
@EnableConfigurationProperties
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TimeSeriesStore timeSeriesStore(StoreConfig config, Clock clock) {
        return new TimeSeriesStore(config, clock);
    }
}
