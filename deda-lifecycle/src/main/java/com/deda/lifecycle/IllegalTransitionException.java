package com.deda.lifecycle;

/** The target is not adjacent to the current state. Nothing was evaluated or invoked. */
public class IllegalTransitionException extends LifecycleException {

    private final GateState from;
    private final GateState to;

    public IllegalTransitionException(AssetId assetId, GateState from, GateState to) {
        super(assetId, "Illegal transition for " + assetId + ": " + from + " -> " + to
                + (from.isTerminal() ? " (" + from + " is terminal)" : "; allowed: " + from.allowedTargets()));
        this.from = from;
        this.to = to;
    }

    public GateState getFrom() {
        return from;
    }

    public GateState getTo() {
        return to;
    }
}
