package com.wpanther.ocppcentral.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Shared scheduler for outbound call timeouts and the heartbeat watchdog
 */
@Configuration
public class OcppConfig implements SchedulingConfigurer {

    @Value("${ocpp.scheduler.pool-size:2}")
    private int poolSize;

    /**
     * Scheduled executor used to expire pending outbound OCPP calls
     *
     * @return executor shut down with the application context
     */
    @Bean(name = "ocppCallScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService ocppCallScheduler() {
        return Executors.newScheduledThreadPool(poolSize, new CustomizableThreadFactory("ocpp-scheduler-"));
    }

    // The WebSocket support registers its own TaskScheduler; @Scheduled methods must not land on it
    @Override
    public void configureTasks(ScheduledTaskRegistrar taskRegistrar) {
        taskRegistrar.setScheduler(ocppCallScheduler());
    }
}
