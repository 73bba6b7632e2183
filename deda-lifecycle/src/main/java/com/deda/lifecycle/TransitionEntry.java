package com.deda.lifecycle;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One line of an asset's audit history. Immutable.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TransitionEntry {

    private final long timestampMillis;
    private final GateState from;
    private final GateState to;
    private final String actor;
    private final List<String> plugins;
    private final TransitionOutcome outcome;
    private final String reason;

    @JsonCreator
    public TransitionEntry(
            @JsonProperty("timestampMillis") long timestampMillis,
            @JsonProperty("from") GateState from,
            @JsonProperty("to") GateState to,
            @JsonProperty("actor") String actor,
            @JsonProperty("plugins") List<String> plugins,
            @JsonProperty("outcome") TransitionOutcome outcome,
            @JsonProperty("reason") String reason) {
        this.timestampMillis = timestampMillis;
        this.from = Objects.requireNonNull(from, "from");
        this.to = Objects.requireNonNull(to, "to");
        this.actor = actor;
        this.plugins = plugins != null ? List.copyOf(plugins) : Collections.emptyList();
        this.outcome = Objects.requireNonNull(outcome, "outcome");
        this.reason = reason;
    }

    public long getTimestampMillis() {
        return timestampMillis;
    }

    public GateState getFrom() {
        return from;
    }

    public GateState getTo() {
        return to;
    }

    public String getActor() {
        return actor;
    }

    /** Plugin ids ({@code name@version}) invoked for this transition, in call order. */
    public List<String> getPlugins() {
        return plugins;
    }

    public TransitionOutcome getOutcome() {
        return outcome;
    }

    /** Failure reason for FAILED entries; a note (e.g. undelivered notification) or null otherwise. */
    public String getReason() {
        return reason;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TransitionEntry that = (TransitionEntry) o;
        return timestampMillis == that.timestampMillis
                && from == that.from
                && to == that.to
                && Objects.equals(actor, that.actor)
                && plugins.equals(that.plugins)
                && outcome == that.outcome
                && Objects.equals(reason, that.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestampMillis, from, to, actor, plugins, outcome, reason);
    }

    @Override
    public String toString() {
        return from + "->" + to + " " + outcome + " by " + actor + (reason != null ? " (" + reason + ")" : "");
    }
}
