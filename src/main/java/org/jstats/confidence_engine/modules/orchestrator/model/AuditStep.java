package org.jstats.confidence_engine.modules.orchestrator.model;

/**
 * One stage of the correction chain and what it did to the running confidence.
 */
public record AuditStep(String stage, int before, int after, String note) {
}
