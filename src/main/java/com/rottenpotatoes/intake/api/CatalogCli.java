package com.rottenpotatoes.intake.api;

import com.rottenpotatoes.intake.domain.review.Movie;
import com.rottenpotatoes.intake.domain.review.Review;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Catalog reads: {@code movies} lists the seeded movies, {@code reviews movieId=N [limit=K]} lists the newest
 * reviews of one movie.
 */
public final class CatalogCli {
  private static final String MOVIES_USAGE = "usage: intake movies [config keys]";
  private static final String REVIEWS_USAGE = "usage: intake reviews movieId=N [limit=K] [config keys]";
  private static final String MOVIES_HELP = """
      List movies

      Usage:
        intake movies [options]

      Output: one JSON array of {"id", "name", "description"}
      """;
  private static final String REVIEWS_HELP = """
      List the newest reviews of a movie

      Usage:
        intake reviews movieId=N [limit=K] [options]

      Options:
        limit=K            Number of reviews, clamped to 1..100 (default recentLimit)

      Output: one JSON array of {"id", "movie_id", "review", "isPos"}, newest first
      """;

  private CatalogCli() {}

  static ExitCode runMovies(String[] args) {
    return CommandSupport.execute("movies", MOVIES_USAGE, MOVIES_HELP, args, (root, kv) -> {
      List<Map<String, Object>> out = new ArrayList<>();
      for (Movie movie : root.catalog().movies()) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", movie.id());
        row.put("name", movie.name());
        row.put("description", movie.description());
        out.add(row);
      }
      CliPrinter.printJson(out);
      return ExitCode.SUCCESS;
    });
  }

  static ExitCode runReviews(String[] args) {
    return CommandSupport.execute("reviews", REVIEWS_USAGE, REVIEWS_HELP, args, (root, kv) -> {
      int movieId = CliArgsParser.requirePositiveInt(kv, "movieId");
      List<Review> reviews = kv.containsKey("limit")
          ? root.catalog().recentReviews(movieId, parseLimit(kv.get("limit")))
          : root.catalog().recentReviews(movieId);
      List<Map<String, Object>> out = new ArrayList<>();
      for (Review review : reviews) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", review.id());
        row.put("movie_id", review.movieId());
        row.put("review", review.text());
        row.put("isPos", review.positive());
        out.add(row);
      }
      CliPrinter.printJson(out);
      return ExitCode.SUCCESS;
    });
  }

  private static int parseLimit(String raw) {
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("limit must be an integer (was " + raw + ")", ex);
    }
  }
}
