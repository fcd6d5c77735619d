package com.buildingsync.config;

import com.buildingsync.poller.PollingStrategy;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * Application configuration for the building sync engine
 */
@Configuration
public class BuildingSyncConfiguration {
    
    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
    
    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, BuildingSyncProperties properties) {
        return builder
                .setConnectTimeout(Duration.ofMillis(properties.getSource().getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(properties.getSource().getReadTimeoutMs()))
                .build();
    }
    
    /**
     * Single thread: poll cycles are serialized anyway
     */
    @Bean
    public ThreadPoolTaskScheduler pollerTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("building-sync-poller-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }
    
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
    
    @Bean
    public PollingStrategy pollingStrategy(BuildingSyncProperties properties) {
        BuildingSyncProperties.Polling polling = properties.getPolling();
        return new PollingStrategy(polling.fastInterval(), polling.slowInterval(),
                polling.getQuietCyclesBeforeSlowdown(), polling.isAdaptive());
    }
}
