package com.callsign.resolution.segment;

import com.callsign.resolution.core.model.CallsignError;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of segmenting a callsign: the classified parts and either the shape of the
 * call or the reason it is malformed.
 */
public final class Segmentation {

    private final List<CallsignPart> parts;
    private final CallsignShape shape;
    private final CallsignError error;

    private Segmentation(List<CallsignPart> parts, CallsignShape shape, CallsignError error) {
        this.parts = List.copyOf(parts);
        this.shape = shape;
        this.error = error;
    }

    public static Segmentation of(List<CallsignPart> parts, CallsignShape shape) {
        return new Segmentation(parts, Objects.requireNonNull(shape, "shape is required"), null);
    }

    public static Segmentation failed(List<CallsignPart> parts, CallsignError error) {
        return new Segmentation(parts, null, Objects.requireNonNull(error, "error is required"));
    }

    public List<CallsignPart> getParts() {
        return parts;
    }

    public Optional<CallsignShape> getShape() {
        return Optional.ofNullable(shape);
    }

    public Optional<CallsignError> getError() {
        return Optional.ofNullable(error);
    }

    public boolean isValid() {
        return error == null;
    }

    /**
     * Text of the part at the given position.
     */
    public String part(int index) {
        return parts.get(index).text();
    }

    /**
     * Texts of all parts from the given position to the end.
     */
    public List<String> partsFrom(int index) {
        return parts.subList(index, parts.size()).stream()
                .map(CallsignPart::text)
                .toList();
    }

    @Override
    public String toString() {
        return "Segmentation{parts=" + parts +
                (shape != null ? ", shape=" + shape : ", error=" + error) + '}';
    }
}
