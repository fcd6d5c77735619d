package com.buildingsync.fetcher;

/**
 * Network boundary: one call to the remote source, raw JSON back
 */
public interface BuildingDataFetcher {
    
    /**
     * @return the response body, never empty
     * @throws TransportException on I/O failure or a non-success status
     */
    String fetch() throws TransportException;
}
