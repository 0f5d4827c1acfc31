package com.rottenpotatoes.intake.api;

import com.rottenpotatoes.intake.config.IntakeConfig;
import com.rottenpotatoes.intake.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Intake command dispatcher.
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE =
      "usage: intake <submit|score|movies|reviews|seed|model> [options]";
  private static final String HELP_TEXT = """
      Review intake command dispatcher

      Usage:
        intake <command> [key=value ...] [flags]

      Commands:
        submit      Classify and store a review (submit --help for details)
        score       Show a movie's freshness score
        movies      List movies
        reviews     List the newest reviews of a movie
        seed        Load the seed dataset into an empty store
        model       Show the resolved classifier artifact

      Configuration keys (any command):
        modelRoot, modelMarker, versionDepth, store, sqlitePath, seedDataset, seedOnStart,
        remoteSink.url, remoteSink.timeoutMs, remoteSink.maxInFlight, events.logger, recentLimit

      Global flags:
        --config=PATH  YAML file with common and intake sections
        --help         Show this message
        --verbose      Enable DEBUG logging
      """;

  private Main() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    String[] remainder = args == null ? new String[0] : args;
    if (remainder.length == 0) {
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    String command = remainder[0].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(remainder, 1, remainder.length);
    if (Arrays.asList(delegateArgs).contains("--verbose")) {
      LoggingConfigurator.enableVerboseLogging(IntakeConfig.defaultsAsMap().get(IntakeConfig.EVENTS_LOGGER));
      log.debug("Verbose logging enabled for dispatcher");
    }

    return switch (command) {
      case "--help", "-h", "help" -> {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        yield ExitCode.SUCCESS;
      }
      case "submit" -> SubmitCli.run(delegateArgs);
      case "score" -> ScoreCli.run(delegateArgs);
      case "movies" -> CatalogCli.runMovies(delegateArgs);
      case "reviews" -> CatalogCli.runReviews(delegateArgs);
      case "seed" -> SeedCli.run(delegateArgs);
      case "model" -> ModelCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
