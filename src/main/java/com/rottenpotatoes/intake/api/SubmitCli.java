package com.rottenpotatoes.intake.api;

import com.rottenpotatoes.intake.domain.review.Sentiment;
import com.rottenpotatoes.intake.domain.review.SubmissionResult;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code submit movieId=N text=...}: classifies and stores one review.
 *
 * <p>Prints {@code movie_id}, {@code review_id}, {@code sentiment}, {@code is_positive} and
 * {@code model_version} on success; otherwise {@code error}, {@code detail} and {@code model_version} with the
 * exit code of the failure kind.</p>
 */
public final class SubmitCli {
  private static final String SUMMARY_USAGE = "usage: intake submit movieId=N text=\"review text\" [config keys]";
  private static final String HELP_TEXT = """
      Submit a review

      Usage:
        intake submit movieId=N text="review text" [options]

      Options:
        movieId=N          Target movie id (positive integer; existence is not checked)
        text=TEXT          Review text, quoted as one argument
        --config=PATH      YAML configuration (common + intake sections)
        --verbose          Enable DEBUG logging
        --help             Show this message

      Exit codes:
        0 committed, 6 model unavailable, 7 classification failed, 8 persistence failed
      """;

  private SubmitCli() {}

  static ExitCode run(String[] args) {
    return CommandSupport.execute("submit", SUMMARY_USAGE, HELP_TEXT, args, (root, kv) -> {
      int movieId = CliArgsParser.requirePositiveInt(kv, "movieId");
      String text = CliArgsParser.requireText(kv, "text");
      SubmissionResult result = root.ingestion().submit(movieId, text);
      CliPrinter.printJson(render(result));
      return result.errorKind().map(ExitCode::forError).orElse(ExitCode.SUCCESS);
    });
  }

  static Map<String, Object> render(SubmissionResult result) {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("movie_id", result.movieId());
    if (result.committed()) {
      out.put("review_id", result.reviewId());
      out.put("sentiment", result.label());
      out.put("is_positive", result.sentiment().map(Sentiment::isPositive).orElse(false));
    } else {
      out.put("error", result.outcome().name());
      out.put("detail", result.detail());
      if (result.label() != null) {
        out.put("sentiment", result.label());
      }
    }
    out.put("model_version", result.modelVersion());
    return out;
  }
}
