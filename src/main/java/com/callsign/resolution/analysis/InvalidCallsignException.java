package com.callsign.resolution.analysis;

import com.callsign.resolution.core.model.CallsignError;

/**
 * Runtime exception thrown when a caller demands a resolved callsign for a call that
 * cannot be resolved.
 */
public class InvalidCallsignException extends RuntimeException {

    private final String call;
    private final CallsignError error;

    public InvalidCallsignException(String call, CallsignError error) {
        super(error.getMessage() + ": " + call);
        this.call = call;
        this.error = error;
    }

    public String getCall() {
        return call;
    }

    public CallsignError getError() {
        return error;
    }
}
