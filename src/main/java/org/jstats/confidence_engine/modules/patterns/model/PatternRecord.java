package org.jstats.confidence_engine.modules.patterns.model;

public record PatternRecord(String signature, int wins, int losses) {

    public int total() {
        return wins + losses;
    }

    public double winRate() {
        int total = total();
        return total == 0 ? 0.0 : (double) wins / total;
    }
}
