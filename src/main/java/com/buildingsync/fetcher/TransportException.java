package com.buildingsync.fetcher;

/**
 * The fetch did not produce a payload. Polling state is not affected.
 */
public class TransportException extends Exception {
    
    /** HTTP status, or 0 when no response was received */
    private final int statusCode;
    
    public TransportException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }
    
    public TransportException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }
    
    public int getStatusCode() {
        return statusCode;
    }
    
    public boolean isUnauthorized() {
        return statusCode == 401;
    }
}
