package com.buildingsync.exception;

/**
 * The fetched payload cannot be read as a collection of building records.
 * The whole cycle is abandoned and the cache keeps its previous state.
 */
public class MalformedPayloadException extends Exception {
    
    public MalformedPayloadException(String message) {
        super(message);
    }
    
    public MalformedPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
