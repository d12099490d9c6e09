package com.dcruver.gitpet.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Beans shared by the scanner and the progression engine.
 */
@Configuration
@Slf4j
public class ScanConfiguration {

    /**
     * System clock in the local zone; day boundaries (streak, weekly window,
     * first visit of the day) are local midnights of this clock.
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * Executor the health scanner fans its collectors out on.
     * One thread per collector so no collector waits behind another.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService scanExecutor(@Value("${gitpet.scan.parallelism:7}") int parallelism) {
        log.debug("Creating scan executor with {} threads", parallelism);
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("health-scan-");
        threadFactory.setDaemon(true);
        return Executors.newFixedThreadPool(Math.max(1, parallelism), threadFactory);
    }
}
