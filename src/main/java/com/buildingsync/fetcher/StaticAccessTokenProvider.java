package com.buildingsync.fetcher;

import com.buildingsync.config.BuildingSyncProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Token from {@code building-sync.source.access-token}. Expiry can only be logged.
 */
@Component
@Slf4j
public class StaticAccessTokenProvider implements AccessTokenProvider {
    
    private final BuildingSyncProperties properties;
    
    public StaticAccessTokenProvider(BuildingSyncProperties properties) {
        this.properties = properties;
    }
    
    @Override
    public Optional<String> currentToken() {
        String token = properties.getSource().getAccessToken();
        return token == null || token.isBlank() ? Optional.empty() : Optional.of(token.trim());
    }
    
    @Override
    public void onCredentialExpired() {
        log.warn("Access token was rejected by {}; configure a fresh building-sync.source.access-token",
                properties.getSource().getBaseUrl());
    }
}
