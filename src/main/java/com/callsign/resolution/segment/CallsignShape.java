package com.callsign.resolution.segment;

/**
 * Valid overall shapes of a callsign, the terminal states of the segmentation.
 */
public enum CallsignShape {
    /**
     * The call is exactly one prefix-like part without appendices, e.g. {@code W1AW}.
     */
    SINGLE_PREFIX,

    /**
     * One prefix-like part followed by one or more appendices, e.g. {@code W1AW/P}.
     */
    ONE_PREFIX_WITH_APPENDICES,

    /**
     * Two leading prefix-like parts followed by zero or more appendices, e.g. {@code F/W1AW/P}.
     */
    TWO_PREFIXES
}
