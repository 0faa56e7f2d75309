package org.jstats.confidence_engine.modules.patterns.service;

import org.jspecify.annotations.NullMarked;
import org.jstats.confidence_engine.core.model.BetCategory;
import org.jstats.confidence_engine.modules.features.model.FeatureVector;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.jstats.confidence_engine.modules.features.model.FeatureField.*;

/**
 * Discretizes a match into a handful of categorical labels. The sorted label set plus the
 * category is the pattern signature, so the key space stays small and bounded.
 */
@Component
@NullMarked
public class PatternDetector {

    static final int MUCH_HIGHER_GAP = 10;
    static final int HIGHER_GAP = 4;
    static final int HOT_WINS = 4;
    static final int COLD_WINS = 1;
    static final int H2H_DOMINANCE = 3;
    static final double HIGH_GOALS = 3.0;
    static final double LOW_GOALS = 2.0;

    public String detect(FeatureVector features, BetCategory category) {
        List<String> labels = new ArrayList<>();

        // Lower table position is better, so a positive gap means the home side sits higher.
        int gap = features.getInt(AWAY_POSITION) - features.getInt(HOME_POSITION);
        labels.add("pos:" + positionBucket(gap));

        formHeat("home", features.getInt(HOME_WINS), labels);
        formHeat("away", features.getInt(AWAY_WINS), labels);

        if (features.getInt(H2H_HOME_WINS) >= H2H_DOMINANCE) {
            labels.add("h2h:home_dominant");
        } else if (features.getInt(H2H_AWAY_WINS) >= H2H_DOMINANCE) {
            labels.add("h2h:away_dominant");
        }

        double expectedGoals = features.get(EXPECTED_GOALS);
        if (expectedGoals >= HIGH_GOALS) {
            labels.add("goals:high");
        } else if (expectedGoals <= LOW_GOALS) {
            labels.add("goals:low");
        }

        Collections.sort(labels);
        return category.code() + "#" + String.join("|", labels);
    }

    private static String positionBucket(int gap) {
        if (gap >= MUCH_HIGHER_GAP) return "home_much_higher";
        if (gap >= HIGHER_GAP) return "home_higher";
        if (gap <= -MUCH_HIGHER_GAP) return "away_much_higher";
        if (gap <= -HIGHER_GAP) return "away_higher";
        return "equal";
    }

    private static void formHeat(String side, int winsOfLastFive, List<String> labels) {
        if (winsOfLastFive >= HOT_WINS) {
            labels.add(side + ":hot");
        } else if (winsOfLastFive <= COLD_WINS) {
            labels.add(side + ":cold");
        }
    }
}
