package org.jstats.confidence_engine.modules.orchestrator.model;

public enum Outcome {
    WIN,
    LOSS,
    PUSH,
    PENDING;

    /** WIN and LOSS teach the learners something; a push or an open bet does not. */
    public boolean isDecisive() {
        return this == WIN || this == LOSS;
    }
}
