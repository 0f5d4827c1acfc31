package com.rottenpotatoes.intake.infrastructure.persistence.jdbc;

import com.rottenpotatoes.intake.application.port.PersistenceException;
import com.rottenpotatoes.intake.application.port.PersistencePort;
import com.rottenpotatoes.intake.domain.review.Movie;
import com.rottenpotatoes.intake.domain.review.Review;
import com.rottenpotatoes.intake.domain.review.ReviewDraft;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link PersistencePort} backed by a SQLite database file.
 * <p><strong>Why:</strong> Keeps reviews across process restarts for the CLI and any routing layer in front of
 * it.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Create the schema from {@code /db/schema.sql} on construction.</li>
 *   <li>Write each review with one INSERT and one commit.</li>
 *   <li>Seed movies and reviews in a single transaction when neither table has rows.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Opens a connection per operation; SQLite serializes writers and waits up to
 * {@value #BUSY_TIMEOUT_MS} ms for a lock.</p>
 *
 * @since 0.1.0
 */
public final class JdbcReviewStore implements PersistencePort {
  private static final Logger log = LoggerFactory.getLogger(JdbcReviewStore.class);
  private static final String SCHEMA_RESOURCE = "/db/schema.sql";
  static final int BUSY_TIMEOUT_MS = 5000;

  private static final String INSERT_REVIEW =
      "INSERT INTO reviews (movie_id, text, is_positive) VALUES (?, ?, ?)";
  private static final String INSERT_MOVIE =
      "INSERT INTO movies (id, name, description) VALUES (?, ?, ?)";
  private static final String COUNT_REVIEWS = "SELECT COUNT(*) FROM reviews WHERE movie_id = ?";
  private static final String COUNT_POSITIVE =
      "SELECT COUNT(*) FROM reviews WHERE movie_id = ? AND is_positive = 1";
  private static final String RECENT_REVIEWS =
      "SELECT id, movie_id, text, is_positive FROM reviews WHERE movie_id = ? ORDER BY id DESC LIMIT ?";
  private static final String LIST_MOVIES = "SELECT id, name, description FROM movies ORDER BY id";
  private static final String HAS_ROWS =
      "SELECT EXISTS(SELECT 1 FROM movies) OR EXISTS(SELECT 1 FROM reviews)";

  private final String jdbcUrl;
  private final Properties connectionProperties = new Properties();

  /**
   * Opens (creating if needed) the database at {@code databaseFile} and applies the schema.
   *
   * @param databaseFile SQLite database path; parent directories are created
   * @return ready store
   * @throws PersistenceException if the directory or schema cannot be created
   */
  public static JdbcReviewStore open(Path databaseFile) {
    Path file = Objects.requireNonNull(databaseFile, "databaseFile").toAbsolutePath();
    try {
      if (file.getParent() != null) {
        Files.createDirectories(file.getParent());
      }
    } catch (IOException ex) {
      throw new PersistenceException("cannot create directory for " + file, ex);
    }
    return new JdbcReviewStore("jdbc:sqlite:" + file);
  }

  /**
   * @param jdbcUrl SQLite JDBC URL
   * @throws PersistenceException if the schema cannot be applied
   */
  public JdbcReviewStore(String jdbcUrl) {
    this.jdbcUrl = Objects.requireNonNull(jdbcUrl, "jdbcUrl");
    connectionProperties.setProperty("busy_timeout", Integer.toString(BUSY_TIMEOUT_MS));
    applySchema();
    log.debug("SQLite review store ready at {}", jdbcUrl);
  }

  @Override
  public long createReview(int movieId, String text, boolean positive) {
    Objects.requireNonNull(text, "text");
    try (Connection connection = connect()) {
      connection.setAutoCommit(false);
      try (PreparedStatement insert = connection.prepareStatement(INSERT_REVIEW, Statement.RETURN_GENERATED_KEYS)) {
        insert.setInt(1, movieId);
        insert.setString(2, text);
        insert.setInt(3, positive ? 1 : 0);
        insert.executeUpdate();
        long id;
        try (ResultSet keys = insert.getGeneratedKeys()) {
          if (!keys.next()) {
            throw new SQLException("no generated key returned");
          }
          id = keys.getLong(1);
        }
        connection.commit();
        return id;
      } catch (SQLException ex) {
        rollback(connection);
        throw ex;
      }
    } catch (SQLException ex) {
      throw new PersistenceException("failed to store review for movie " + movieId, ex);
    }
  }

  @Override
  public int countReviews(int movieId) {
    return count(COUNT_REVIEWS, movieId);
  }

  @Override
  public int countPositiveReviews(int movieId) {
    return count(COUNT_POSITIVE, movieId);
  }

  @Override
  public List<Review> listRecentReviews(int movieId, int limit) {
    List<Review> reviews = new ArrayList<>();
    if (limit <= 0) {
      return reviews;
    }
    try (Connection connection = connect();
        PreparedStatement query = connection.prepareStatement(RECENT_REVIEWS)) {
      query.setInt(1, movieId);
      query.setInt(2, limit);
      try (ResultSet rows = query.executeQuery()) {
        while (rows.next()) {
          reviews.add(new Review(rows.getLong(1), rows.getInt(2), rows.getString(3), rows.getInt(4) == 1));
        }
      }
    } catch (SQLException ex) {
      throw new PersistenceException("failed to list reviews for movie " + movieId, ex);
    }
    return List.copyOf(reviews);
  }

  @Override
  public List<Movie> listMovies() {
    List<Movie> movies = new ArrayList<>();
    try (Connection connection = connect();
        PreparedStatement query = connection.prepareStatement(LIST_MOVIES);
        ResultSet rows = query.executeQuery()) {
      while (rows.next()) {
        movies.add(new Movie(rows.getInt(1), rows.getString(2), rows.getString(3)));
      }
    } catch (SQLException ex) {
      throw new PersistenceException("failed to list movies", ex);
    }
    return List.copyOf(movies);
  }

  @Override
  public boolean seedIfEmpty(List<Movie> movies, List<ReviewDraft> reviews) {
    Objects.requireNonNull(movies, "movies");
    Objects.requireNonNull(reviews, "reviews");
    try (Connection connection = connect()) {
      connection.setAutoCommit(false);
      try {
        if (hasRows(connection)) {
          connection.rollback();
          return false;
        }
        try (PreparedStatement insert = connection.prepareStatement(INSERT_MOVIE)) {
          for (Movie movie : movies) {
            insert.setInt(1, movie.id());
            insert.setString(2, movie.name());
            insert.setString(3, movie.description());
            insert.addBatch();
          }
          insert.executeBatch();
        }
        try (PreparedStatement insert = connection.prepareStatement(INSERT_REVIEW)) {
          for (ReviewDraft review : reviews) {
            insert.setInt(1, review.movieId());
            insert.setString(2, review.text());
            insert.setInt(3, review.positive() ? 1 : 0);
            insert.addBatch();
          }
          insert.executeBatch();
        }
        connection.commit();
        return true;
      } catch (SQLException ex) {
        rollback(connection);
        throw ex;
      }
    } catch (SQLException ex) {
      throw new PersistenceException("failed to seed store", ex);
    }
  }

  private int count(String sql, int movieId) {
    try (Connection connection = connect();
        PreparedStatement query = connection.prepareStatement(sql)) {
      query.setInt(1, movieId);
      try (ResultSet rows = query.executeQuery()) {
        return rows.next() ? rows.getInt(1) : 0;
      }
    } catch (SQLException ex) {
      throw new PersistenceException("failed to count reviews for movie " + movieId, ex);
    }
  }

  private static boolean hasRows(Connection connection) throws SQLException {
    try (Statement statement = connection.createStatement();
        ResultSet rows = statement.executeQuery(HAS_ROWS)) {
      return rows.next() && rows.getInt(1) != 0;
    }
  }

  private Connection connect() throws SQLException {
    return DriverManager.getConnection(jdbcUrl, connectionProperties);
  }

  private void applySchema() {
    String script;
    try (InputStream in = JdbcReviewStore.class.getResourceAsStream(SCHEMA_RESOURCE)) {
      if (in == null) {
        throw new PersistenceException("schema resource " + SCHEMA_RESOURCE + " not found");
      }
      script = new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException ex) {
      throw new PersistenceException("cannot read " + SCHEMA_RESOURCE, ex);
    }
    try (Connection connection = connect(); Statement statement = connection.createStatement()) {
      for (String ddl : statements(script)) {
        statement.executeUpdate(ddl);
      }
    } catch (SQLException ex) {
      throw new PersistenceException("failed to apply schema to " + jdbcUrl, ex);
    }
  }

  static List<String> statements(String script) {
    StringBuilder withoutComments = new StringBuilder();
    for (String line : script.split("\\R")) {
      String trimmed = line.trim();
      if (!trimmed.startsWith("--")) {
        withoutComments.append(line).append('\n');
      }
    }
    List<String> statements = new ArrayList<>();
    for (String part : withoutComments.toString().split(";")) {
      if (!part.isBlank()) {
        statements.add(part.trim());
      }
    }
    return statements;
  }

  private static void rollback(Connection connection) {
    try {
      connection.rollback();
    } catch (SQLException ex) {
      log.warn("Rollback failed", ex);
    }
  }
}
