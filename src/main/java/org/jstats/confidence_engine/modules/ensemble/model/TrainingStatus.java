package org.jstats.confidence_engine.modules.ensemble.model;

public enum TrainingStatus {
    TRAINED,
    INSUFFICIENT_DATA,
    FAILED
}
