package com.callsign.resolution.segment;

import java.util.Objects;

/**
 * One {@code /}-separated part of a callsign and its classification.
 *
 * @param text the part as it appears in the call
 * @param type whether the part is a prefix
 */
public record CallsignPart(String text, PartType type) {

    public CallsignPart {
        Objects.requireNonNull(text, "text is required");
        Objects.requireNonNull(type, "type is required");
    }

    public boolean isPrefix() {
        return type == PartType.PREFIX;
    }

    /**
     * Returns true for parts consisting of one digit, like the {@code 9} of {@code SV0ABC/9}.
     */
    public boolean isSingleDigit() {
        return text.length() == 1 && Character.isDigit(text.charAt(0));
    }
}
