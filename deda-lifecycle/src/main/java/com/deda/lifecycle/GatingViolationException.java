package com.deda.lifecycle;

import java.util.List;

/**
 * One or more gating rules did not hold. No plugin was invoked and no history was written.
 */
public class GatingViolationException extends LifecycleException {

    private final GateState from;
    private final GateState to;
    private final List<String> unmetRules;

    public GatingViolationException(AssetId assetId, GateState from, GateState to, List<String> unmetRules) {
        super(assetId, "Gate " + from + " -> " + to + " not satisfied for " + assetId + ": "
                + String.join("; ", unmetRules));
        this.from = from;
        this.to = to;
        this.unmetRules = List.copyOf(unmetRules);
    }

    public GateState getFrom() {
        return from;
    }

    public GateState getTo() {
        return to;
    }

    /** Rule followed by why it failed, one per unmet rule. */
    public List<String> getUnmetRules() {
        return unmetRules;
    }
}
