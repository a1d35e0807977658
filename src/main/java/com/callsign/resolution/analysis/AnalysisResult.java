package com.callsign.resolution.analysis;

import com.callsign.resolution.core.model.Callsign;
import com.callsign.resolution.core.model.CallsignError;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of analyzing a callsign: either the resolved {@link Callsign} or the
 * {@link CallsignError} explaining why it could not be resolved.
 */
public final class AnalysisResult {

    private final String call;
    private final Callsign callsign;
    private final CallsignError error;

    private AnalysisResult(String call, Callsign callsign, CallsignError error) {
        this.call = call;
        this.callsign = callsign;
        this.error = error;
    }

    public static AnalysisResult success(Callsign callsign) {
        Objects.requireNonNull(callsign, "callsign is required");
        return new AnalysisResult(callsign.getCall(), callsign, null);
    }

    public static AnalysisResult failure(String call, CallsignError error) {
        return new AnalysisResult(call, null, Objects.requireNonNull(error, "error is required"));
    }

    /**
     * The analyzed call as given by the caller.
     */
    public String getCall() {
        return call;
    }

    public boolean isSuccess() {
        return callsign != null;
    }

    public Optional<Callsign> getCallsign() {
        return Optional.ofNullable(callsign);
    }

    public Optional<CallsignError> getError() {
        return Optional.ofNullable(error);
    }

    /**
     * Returns the resolved callsign or throws if the analysis failed.
     *
     * @throws InvalidCallsignException if the call could not be resolved
     */
    public Callsign orElseThrow() {
        if (callsign == null) {
            throw new InvalidCallsignException(call, error);
        }
        return callsign;
    }

    /**
     * Short label of the outcome, used as metric tag.
     */
    public String outcome() {
        return callsign != null ? "resolved" : error.name().toLowerCase(Locale.ROOT);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AnalysisResult that = (AnalysisResult) o;
        return Objects.equals(call, that.call)
                && Objects.equals(callsign, that.callsign)
                && error == that.error;
    }

    @Override
    public int hashCode() {
        return Objects.hash(call, callsign, error);
    }

    @Override
    public String toString() {
        return callsign != null
                ? "AnalysisResult{" + callsign + '}'
                : "AnalysisResult{call='" + call + "', error=" + error + '}';
    }
}
