package com.buildingsync.fetcher;

import java.util.Optional;

/**
 * Supplies the bearer credential for the remote source.
 * Token refresh is owned by the implementation.
 */
public interface AccessTokenProvider {
    
    Optional<String> currentToken();
    
    /**
     * Called when the source rejected the current token
     */
    void onCredentialExpired();
}
