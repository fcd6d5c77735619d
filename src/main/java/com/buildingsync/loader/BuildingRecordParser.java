package com.buildingsync.loader;

import com.buildingsync.exception.MalformedPayloadException;
import com.buildingsync.model.ParsedPayload;

/**
 * Turns a raw energy payload into buildings.
 * Record-level problems become warnings; only an unreadable payload fails.
 */
public interface BuildingRecordParser {
    
    ParsedPayload parse(String payload) throws MalformedPayloadException;
}
