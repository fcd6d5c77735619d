package com.buildingsync.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Named options of the sync engine, bound from {@code building-sync.*}
 */
@Component
@ConfigurationProperties(prefix = "building-sync")
@Data
public class BuildingSyncProperties {
    
    static final double MIN_FAST_INTERVAL_SECONDS = 0.5;
    
    private Polling polling = new Polling();
    private Spatial spatial = new Spatial();
    private Cache cache = new Cache();
    private Source source = new Source();
    
    @Data
    public static class Polling {
        private boolean enabled = true;
        private boolean adaptive = true;
        private double fastIntervalSeconds = 1.0;
        private double slowIntervalSeconds = 5.0;
        private int quietCyclesBeforeSlowdown = 10;
        
        public Duration fastInterval() {
            return toDuration(fastIntervalSeconds);
        }
        
        public Duration slowInterval() {
            return toDuration(slowIntervalSeconds);
        }
    }
    
    @Data
    public static class Spatial {
        private double toleranceMeters = 10.0;
    }
    
    @Data
    public static class Cache {
        /** Evict buildings reported REMOVED instead of only reporting them */
        private boolean evictMissing = false;
    }
    
    @Data
    public static class Source {
        private String baseUrl = "https://backend.gisworld-tech.com";
        private String energyPath = "/geospatial/buildings-energy/";
        private String communityId = "08417008";
        private String fieldType = "basic";
        private String accessToken = "";
        private int connectTimeoutMs = 5000;
        private int readTimeoutMs = 10000;
    }
    
    /**
     * Fail fast on option combinations the poller and index cannot work with
     */
    @PostConstruct
    public void validate() {
        if (!(polling.fastIntervalSeconds > 0) || !(polling.slowIntervalSeconds > 0)) {
            throw new IllegalArgumentException("building-sync.polling intervals must be positive");
        }
        if (polling.fastIntervalSeconds < MIN_FAST_INTERVAL_SECONDS) {
            throw new IllegalArgumentException("building-sync.polling.fast-interval-seconds must be at least "
                    + MIN_FAST_INTERVAL_SECONDS);
        }
        if (polling.slowIntervalSeconds < polling.fastIntervalSeconds) {
            throw new IllegalArgumentException(
                    "building-sync.polling.slow-interval-seconds must not be below the fast interval");
        }
        if (polling.quietCyclesBeforeSlowdown < 1) {
            throw new IllegalArgumentException("building-sync.polling.quiet-cycles-before-slowdown must be at least 1");
        }
        if (!(spatial.toleranceMeters >= 0)) {
            throw new IllegalArgumentException("building-sync.spatial.tolerance-meters must not be negative");
        }
    }
    
    static Duration toDuration(double seconds) {
        return Duration.ofNanos(Math.round(seconds * 1_000_000_000L));
    }
}
