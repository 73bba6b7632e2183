package com.deda.lifecycle;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Development gates of an asset. Forward only, one step at a time:
 * {@code IDEA -> CANDIDATE -> IN_DEVELOPMENT -> REVIEW -> PRODUCTION_READY}. {@code REJECTED} is
 * terminal and reachable only from IDEA and CANDIDATE. Adjacency is fixed; configuration can only
 * add requirements to a legal transition.
 */
public enum GateState {
    IDEA,
    CANDIDATE,
    IN_DEVELOPMENT,
    REVIEW,
    PRODUCTION_READY,
    REJECTED;

    /** The following gate in the forward chain, or null for PRODUCTION_READY and REJECTED. */
    public GateState next() {
        switch (this) {
            case IDEA:
                return CANDIDATE;
            case CANDIDATE:
                return IN_DEVELOPMENT;
            case IN_DEVELOPMENT:
                return REVIEW;
            case REVIEW:
                return PRODUCTION_READY;
            default:
                return null;
        }
    }

    public boolean isRejectable() {
        return this == IDEA || this == CANDIDATE;
    }

    public boolean isTerminal() {
        return this == PRODUCTION_READY || this == REJECTED;
    }

    public boolean canTransitionTo(GateState target) {
        if (target == null) return false;
        return target == next() || (target == REJECTED && isRejectable());
    }

    /** Legal targets from this state: the next gate, then REJECTED where allowed. */
    public List<GateState> allowedTargets() {
        List<GateState> out = new ArrayList<>(2);
        if (next() != null) out.add(next());
        if (isRejectable()) out.add(REJECTED);
        return Collections.unmodifiableList(out);
    }
}
