package com.rottenpotatoes.intake.infrastructure.seed;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rottenpotatoes.intake.application.port.SeedDatasetSource;
import com.rottenpotatoes.intake.domain.review.Movie;
import com.rottenpotatoes.intake.domain.review.ReviewDraft;
import com.rottenpotatoes.intake.domain.review.SeedDataset;
import com.rottenpotatoes.intake.validation.Strings;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads a seed dataset from a JSON document on the classpath ({@code classpath:/seed/movies.json}) or the
 * filesystem (any other location).
 *
 * <p>Layout: {@code {"movies": [{"id", "name", "description"}], "reviews": [{"movieId", "text", "positive"}]}}.</p>
 *
 * @since 0.1.0
 */
public final class JsonSeedDatasetSource implements SeedDatasetSource {
  /** Location prefix selecting a classpath resource. */
  public static final String CLASSPATH_PREFIX = "classpath:";

  private final String location;
  private final ObjectMapper mapper;

  public JsonSeedDatasetSource(String location, ObjectMapper mapper) {
    this.location = Strings.requireNonBlank("seedDataset", location);
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  @Override
  public SeedDataset load() throws IOException {
    JsonNode root;
    try (InputStream in = open()) {
      root = mapper.readTree(in);
    }
    try {
      return new SeedDataset(movies(root), reviews(root));
    } catch (IllegalArgumentException ex) {
      throw new IOException("malformed seed dataset " + location + ": " + ex.getMessage(), ex);
    }
  }

  @Override
  public String describe() {
    return location;
  }

  private InputStream open() throws IOException {
    if (location.startsWith(CLASSPATH_PREFIX)) {
      String resource = location.substring(CLASSPATH_PREFIX.length());
      InputStream in = JsonSeedDatasetSource.class.getResourceAsStream(
          resource.startsWith("/") ? resource : "/" + resource);
      if (in == null) {
        throw new FileNotFoundException("classpath resource " + resource + " not found");
      }
      return in;
    }
    return Files.newInputStream(Path.of(location));
  }

  private static List<Movie> movies(JsonNode root) {
    List<Movie> movies = new ArrayList<>();
    for (JsonNode node : array(root, "movies")) {
      movies.add(new Movie(
          requiredInt(node, "id"),
          requiredText(node, "name"),
          node.path("description").asText("")));
    }
    return movies;
  }

  private static List<ReviewDraft> reviews(JsonNode root) {
    List<ReviewDraft> reviews = new ArrayList<>();
    JsonNode array = root.path("reviews");
    if (array.isMissingNode()) {
      return reviews;
    }
    for (JsonNode node : array(root, "reviews")) {
      JsonNode positive = node.get("positive");
      if (positive == null || !positive.isBoolean()) {
        throw new IllegalArgumentException("review.positive must be a boolean");
      }
      reviews.add(new ReviewDraft(requiredInt(node, "movieId"), requiredText(node, "text"), positive.booleanValue()));
    }
    return reviews;
  }

  private static JsonNode array(JsonNode root, String field) {
    JsonNode node = root == null ? null : root.get(field);
    if (node == null || !node.isArray()) {
      throw new IllegalArgumentException(field + " must be an array");
    }
    return node;
  }

  private static int requiredInt(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || !value.isIntegralNumber() || !value.canConvertToInt()) {
      throw new IllegalArgumentException(field + " must be an integer");
    }
    return value.intValue();
  }

  private static String requiredText(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || !value.isTextual() || value.asText().isBlank()) {
      throw new IllegalArgumentException(field + " must be a non-blank string");
    }
    return value.asText();
  }
}
