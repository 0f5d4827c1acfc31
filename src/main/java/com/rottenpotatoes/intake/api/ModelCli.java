package com.rottenpotatoes.intake.api;

import com.rottenpotatoes.intake.application.model.ActiveModel;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code model}: reports which classifier artifact was resolved, exiting with {@link ExitCode#MODEL_UNAVAILABLE}
 * when none was.
 */
public final class ModelCli {
  private static final String SUMMARY_USAGE = "usage: intake model [modelRoot=DIR] [config keys]";
  private static final String HELP_TEXT = """
      Show the active classifier

      Usage:
        intake model [options]

      Options:
        modelRoot=DIR      Directory searched for the artifact (default mlruns)
        modelMarker=NAME   Marker file naming the artifact directory (default model.json)
        versionDepth=N     Ancestor level naming the version (default 2)
      """;

  private ModelCli() {}

  static ExitCode run(String[] args) {
    return CommandSupport.execute("model", SUMMARY_USAGE, HELP_TEXT, args, (root, kv) -> {
      ActiveModel model = root.model();
      Map<String, Object> out = new LinkedHashMap<>();
      out.put("loaded", model.loaded());
      out.put("model_version", model.versionTag());
      out.put("path", model.locationIfLoaded().map(Object::toString).orElse(null));
      out.put("model_root", root.config().modelRoot().toString());
      CliPrinter.printJson(out);
      return model.loaded() ? ExitCode.SUCCESS : ExitCode.MODEL_UNAVAILABLE;
    });
  }
}
