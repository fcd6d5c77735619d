package com.buildingsync.model.polling;

/**
 * What a completed poll cycle tells the rate controller
 */
public enum CycleOutcome {
    /** At least one building was new or modified */
    CHANGES,
    /** Quiet cycle */
    NO_CHANGES,
    /** Payload could not be parsed; counted as a quiet cycle */
    MALFORMED_PAYLOAD,
    /** Fetch failed; polling state is left untouched */
    TRANSPORT_FAILURE
}
