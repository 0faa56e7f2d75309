package org.jstats.confidence_engine.modules.ensemble.service;

import org.jspecify.annotations.NullMarked;
import org.jstats.confidence_engine.core.config.EngineProperties;
import org.jstats.confidence_engine.core.model.BetCategory;
import org.jstats.confidence_engine.modules.ensemble.model.ModelFamily;
import org.springframework.stereotype.Component;
import org.tribuo.Model;
import org.tribuo.classification.Label;

import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Serialized Tribuo models on local disk, one file per (family, category).
 */
@Component
@NullMarked
public class ModelArtifactStore {

    private final Path directory;

    public ModelArtifactStore(EngineProperties properties) {
        this.directory = Path.of(properties.ensemble().modelDir());
    }

    /**
     * Writes to a temporary file first and moves it into place, so a concurrent reader sees
     * either the old or the new model.
     */
    public Path write(ModelFamily family, BetCategory category, Model<Label> model) {
        try {
            Files.createDirectories(directory);
            Path target = directory.resolve(category.code() + "_" + family.code() + ".ser");
            Path tmp = Files.createTempFile(directory, family.code(), ".tmp");
            try (var out = new ObjectOutputStream(Files.newOutputStream(tmp))) {
                out.writeObject(model);
            }
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            return target;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write model artifact for " + family.code(), e);
        }
    }

    @SuppressWarnings("unchecked")
    public Model<Label> read(Path path) {
        try (var in = new ObjectInputStream(Files.newInputStream(path))) {
            return (Model<Label>) in.readObject();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read model artifact " + path, e);
        } catch (ClassNotFoundException | ClassCastException e) {
            throw new IllegalStateException("Model artifact " + path + " is not a label model", e);
        }
    }
}
