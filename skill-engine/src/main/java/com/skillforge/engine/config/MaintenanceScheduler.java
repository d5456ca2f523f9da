package com.skillforge.engine.config;

import com.skillforge.engine.collect.ParameterCollector;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;

/** Periodic housekeeping: expires idle collection sessions. */
@Configuration
@EnableScheduling
public class MaintenanceScheduler {

    private final ParameterCollector collector;

    public MaintenanceScheduler(ParameterCollector collector) {
        this.collector = collector;
    }

    @Scheduled(fixedDelayString = "${skillforge.collection.sweep-interval:60s}")
    public void sweepSessions() {
        collector.sweep();
    }
}
