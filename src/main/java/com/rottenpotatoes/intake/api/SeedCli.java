package com.rottenpotatoes.intake.api;

import com.rottenpotatoes.intake.application.seed.SeedReport;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code seed}: loads the seed dataset into an empty store and prints the report.
 *
 * <p>With {@code seedOnStart=true} (the default) the startup run is reported; otherwise the seeder runs once
 * here.</p>
 */
public final class SeedCli {
  private static final String SUMMARY_USAGE = "usage: intake seed [seedDataset=PATH] [config keys]";
  private static final String HELP_TEXT = """
      Seed the review store

      Usage:
        intake seed [options]

      Options:
        seedDataset=PATH   JSON dataset (default classpath:/seed/movies.json)
        store=sqlite       Persist to sqlitePath instead of memory

      A store that already holds movies or reviews is left untouched (outcome SKIPPED).
      """;

  private SeedCli() {}

  static ExitCode run(String[] args) {
    return CommandSupport.execute("seed", SUMMARY_USAGE, HELP_TEXT, args, (root, kv) -> {
      SeedReport report = root.startupSeed().orElseGet(root::seed);
      Map<String, Object> out = new LinkedHashMap<>();
      out.put("outcome", report.outcome().name());
      out.put("movies", report.movies());
      out.put("reviews", report.reviews());
      out.put("detail", report.detail());
      CliPrinter.printJson(out);
      return report.errorKind().map(ExitCode::forError).orElse(ExitCode.SUCCESS);
    });
  }
}
