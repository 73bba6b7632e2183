package com.deda.lifecycle;

/** Result recorded in a history entry. */
public enum TransitionOutcome {
    /** The state advanced. */
    APPLIED,
    /** A delegation failed; the state did not change. */
    FAILED
}
