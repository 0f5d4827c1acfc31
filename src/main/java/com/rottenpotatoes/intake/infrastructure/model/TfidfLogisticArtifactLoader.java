package com.rottenpotatoes.intake.infrastructure.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rottenpotatoes.intake.application.port.ArtifactLoadException;
import com.rottenpotatoes.intake.application.port.ArtifactLoader;
import com.rottenpotatoes.intake.application.port.ClassifierPort;
import com.rottenpotatoes.intake.validation.Strings;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Loads the JSON export of a TF-IDF + logistic-regression pipeline.
 * <p><strong>Why:</strong> The training job exports weights in a language-neutral document so the intake
 * service can evaluate the model without the training runtime.</p>
 * <p><strong>Document:</strong> {@code classes} (two labels, negative first), {@code vocabulary}
 * (term to column), {@code idf}, {@code coef}, {@code intercept}, and optional {@code lowercase}
 * (default {@code true}), {@code tokenPattern} (default {@value #DEFAULT_TOKEN_PATTERN}),
 * {@code sublinearTf} (default {@code false}), {@code norm} ({@code l2} or {@code none}, default {@code l2}).</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the shared {@link ObjectMapper}.</p>
 *
 * @since 0.1.0
 */
public final class TfidfLogisticArtifactLoader implements ArtifactLoader {
  private static final Logger log = LoggerFactory.getLogger(TfidfLogisticArtifactLoader.class);
  static final String DEFAULT_TOKEN_PATTERN = "(?u)\\b\\w\\w+\\b";

  private final String markerFileName;
  private final ObjectMapper mapper;

  /**
   * @param markerFileName name of the JSON document inside the artifact directory
   * @param mapper JSON mapper
   */
  public TfidfLogisticArtifactLoader(String markerFileName, ObjectMapper mapper) {
    this.markerFileName = Strings.requireNonBlank("modelMarker", markerFileName);
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  @Override
  public ClassifierPort load(Path artifactDirectory) throws ArtifactLoadException {
    Path document = Objects.requireNonNull(artifactDirectory, "artifactDirectory").resolve(markerFileName);
    JsonNode root;
    try (InputStream in = Files.newInputStream(document)) {
      root = mapper.readTree(in);
    } catch (IOException ex) {
      throw new ArtifactLoadException("cannot read " + document + ": " + ex.getMessage(), ex);
    }
    if (root == null || !root.isObject()) {
      throw new ArtifactLoadException(document + " is not a JSON object");
    }
    try {
      TfidfLogisticClassifier classifier = build(root);
      log.debug("Loaded classifier from {} with classes {}", document, classifier.classes());
      return classifier;
    } catch (IllegalArgumentException ex) {
      throw new ArtifactLoadException("malformed artifact " + document + ": " + ex.getMessage(), ex);
    }
  }

  private TfidfLogisticClassifier build(JsonNode root) {
    List<String> classes = new ArrayList<>();
    for (JsonNode label : array(root, "classes")) {
      if (!label.isTextual() && !label.isNumber() && !label.isBoolean()) {
        throw new IllegalArgumentException("class labels must be scalars");
      }
      classes.add(label.asText());
    }
    double[] idf = doubles(array(root, "idf"), "idf");
    double[] coef = doubles(array(root, "coef"), "coef");
    if (idf.length != coef.length) {
      throw new IllegalArgumentException(
          "idf has " + idf.length + " columns but coef has " + coef.length);
    }
    Map<String, Integer> vocabulary = vocabulary(root, idf.length);
    JsonNode intercept = root.get("intercept");
    if (intercept == null || !intercept.isNumber()) {
      throw new IllegalArgumentException("intercept must be a number");
    }
    boolean lowercase = root.path("lowercase").asBoolean(true);
    boolean sublinearTf = root.path("sublinearTf").asBoolean(false);
    String norm = root.path("norm").asText("l2").toLowerCase(Locale.ROOT);
    if (!norm.equals("l2") && !norm.equals("none")) {
      throw new IllegalArgumentException("unsupported norm '" + norm + "'");
    }
    Pattern tokens = tokenPattern(root.path("tokenPattern").asText(DEFAULT_TOKEN_PATTERN));
    return new TfidfLogisticClassifier(
        classes, vocabulary, idf, coef, intercept.asDouble(), lowercase, tokens, sublinearTf, norm.equals("l2"));
  }

  private static JsonNode array(JsonNode root, String field) {
    JsonNode node = root.get(field);
    if (node == null || !node.isArray()) {
      throw new IllegalArgumentException(field + " must be an array");
    }
    return node;
  }

  private static double[] doubles(JsonNode array, String field) {
    double[] values = new double[array.size()];
    for (int i = 0; i < values.length; i++) {
      JsonNode value = array.get(i);
      if (!value.isNumber()) {
        throw new IllegalArgumentException(field + "[" + i + "] must be a number");
      }
      values[i] = value.asDouble();
    }
    return values;
  }

  private static Map<String, Integer> vocabulary(JsonNode root, int columns) {
    JsonNode node = root.get("vocabulary");
    if (node == null || !node.isObject()) {
      throw new IllegalArgumentException("vocabulary must be an object");
    }
    Map<String, Integer> vocabulary = new HashMap<>();
    Iterator<Map.Entry<String, JsonNode>> entries = node.fields();
    while (entries.hasNext()) {
      Map.Entry<String, JsonNode> entry = entries.next();
      JsonNode column = entry.getValue();
      if (!column.canConvertToInt() || !column.isIntegralNumber()
          || column.asInt() < 0 || column.asInt() >= columns) {
        throw new IllegalArgumentException("vocabulary term '" + entry.getKey() + "' has invalid column");
      }
      vocabulary.put(entry.getKey(), column.asInt());
    }
    return vocabulary;
  }

  /**
   * Compiles the exported token pattern. The exporter writes Python regex syntax where {@code (?u)} selects
   * Unicode character classes; Java spells that flag {@code (?U)}.
   */
  static Pattern tokenPattern(String exported) {
    String javaPattern = exported.replace("(?u)", "(?U)");
    try {
      return Pattern.compile(javaPattern);
    } catch (PatternSyntaxException ex) {
      throw new IllegalArgumentException("invalid tokenPattern: " + ex.getDescription(), ex);
    }
  }
}
