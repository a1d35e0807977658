package com.callsign.resolution.segment;

/**
 * Classification of a {@code /}-separated part of a callsign.
 */
public enum PartType {
    PREFIX,
    OTHER
}
