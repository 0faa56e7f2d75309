package org.jstats.confidence_engine.modules.ensemble.service;

import org.jstats.confidence_engine.modules.ensemble.model.TrainingSample;
import org.jstats.confidence_engine.modules.features.model.FeatureSchema;
import org.jstats.confidence_engine.modules.features.model.FeatureVector;
import org.tribuo.Example;
import org.tribuo.MutableDataset;
import org.tribuo.classification.Label;
import org.tribuo.classification.LabelFactory;
import org.tribuo.impl.ArrayExample;
import org.tribuo.provenance.SimpleDataSourceProvenance;

import java.util.List;

/**
 * Bridges feature vectors to Tribuo examples. Feature names are the schema keys, so a model
 * only ever sees the columns it was trained on.
 */
final class LabeledExamples {

    static final Label WIN = new Label("WIN");
    static final Label LOSS = new Label("LOSS");

    private static final LabelFactory LABEL_FACTORY = new LabelFactory();

    private LabeledExamples() {
    }

    static Example<Label> unlabeled(FeatureVector features) {
        return new ArrayExample<>(LabelFactory.UNKNOWN_LABEL, FeatureSchema.names(), features.toArray());
    }

    static MutableDataset<Label> dataset(String description, List<TrainingSample> samples) {
        var dataset = new MutableDataset<>(new SimpleDataSourceProvenance(description, LABEL_FACTORY), LABEL_FACTORY);
        for (TrainingSample sample : samples) {
            dataset.add(new ArrayExample<>(sample.won() ? WIN : LOSS, FeatureSchema.names(), sample.features().toArray()));
        }
        return dataset;
    }

    static boolean isWin(Label label) {
        return WIN.getLabel().equals(label.getLabel());
    }
}
