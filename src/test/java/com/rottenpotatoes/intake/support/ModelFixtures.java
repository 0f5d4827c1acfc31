package com.rottenpotatoes.intake.support;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes small classifier artifacts for tests.
 *
 * <p>The fixture model knows four terms: {@code great} and {@code loved} push towards {@code positive},
 * {@code awful} and {@code boring} towards {@code negative}. Text without known terms is negative.</p>
 */
public final class ModelFixtures {
  public static final String MARKER = "model.json";

  public static final String MODEL_JSON = """
      {
        "classes": ["negative", "positive"],
        "vocabulary": {"great": 0, "loved": 1, "awful": 2, "boring": 3},
        "idf": [1.0, 1.0, 1.0, 1.0],
        "coef": [2.0, 2.0, -2.0, -2.0],
        "intercept": 0.0,
        "lowercase": true,
        "norm": "l2",
        "tokenPattern": "(?u)\\\\b\\\\w\\\\w+\\\\b"
      }
      """;

  private ModelFixtures() {}

  /**
   * Writes the fixture artifact in an MLflow-like layout: {@code root/<experiment>/<run>/artifacts/model}.
   *
   * @return the artifact directory
   */
  public static Path writeModel(Path root, String experiment, String run) {
    return writeArtifact(root.resolve(experiment).resolve(run).resolve("artifacts").resolve("model"), MODEL_JSON);
  }

  public static Path writeArtifact(Path directory, String json) {
    try {
      Files.createDirectories(directory);
      Files.writeString(directory.resolve(MARKER), json);
      return directory;
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
  }
}
