package com.callsign.resolution.core.model;

/**
 * Reasons a callsign cannot be resolved. All of them are final classification
 * outcomes: analyzing the same call at the same instant fails the same way.
 */
public enum CallsignError {
    BASIC_FORMAT("Callsign is of invalid format or includes invalid characters"),
    INVALID_OPERATION("Callsign was used in an invalid operation"),
    BEGIN_WITHOUT_PREFIX("Callsign does not begin with a valid prefix"),
    THIRD_PREFIX("Unexpected third prefix"),
    MULTIPLE_SINGLE_DIGIT_APPENDICES("Multiple single digit appendices"),
    MULTIPLE_SPECIAL_APPENDICES("Multiple special appendices that indicate no entity");

    private final String message;

    CallsignError(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
