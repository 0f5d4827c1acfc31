package com.rottenpotatoes.intake.api;

import com.rottenpotatoes.intake.domain.review.ScoreSnapshot;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code score movieId=N}: prints the freshness score of a movie.
 */
public final class ScoreCli {
  private static final String SUMMARY_USAGE = "usage: intake score movieId=N [config keys]";
  private static final String HELP_TEXT = """
      Show a movie's freshness score

      Usage:
        intake score movieId=N [options]

      Output:
        {"movie_id", "total_reviews", "positive_count", "score", "status"}
        status is CERTIFIED_HOT (>= 75), FRESH (>= 60), ROTTEN, or NO_REVIEWS
      """;

  private ScoreCli() {}

  static ExitCode run(String[] args) {
    return CommandSupport.execute("score", SUMMARY_USAGE, HELP_TEXT, args, (root, kv) -> {
      ScoreSnapshot snapshot = root.scores().score(CliArgsParser.requirePositiveInt(kv, "movieId"));
      Map<String, Object> out = new LinkedHashMap<>();
      out.put("movie_id", snapshot.movieId());
      out.put("total_reviews", snapshot.totalReviews());
      out.put("positive_count", snapshot.positiveCount());
      out.put("score", snapshot.score());
      out.put("status", snapshot.status().name());
      CliPrinter.printJson(out);
      return ExitCode.SUCCESS;
    });
  }
}
