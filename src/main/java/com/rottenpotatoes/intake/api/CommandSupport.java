package com.rottenpotatoes.intake.api;

import com.rottenpotatoes.intake.application.port.PersistenceException;
import com.rottenpotatoes.intake.config.CompositionRoot;
import com.rottenpotatoes.intake.config.ConfigMerger;
import com.rottenpotatoes.intake.config.IntakeConfig;
import com.rottenpotatoes.intake.config.YamlConfigLoader;
import com.rottenpotatoes.intake.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared flow of every intake command: parse arguments, merge configuration, build the composition root, run
 * the command body, and map failures to exit codes.
 */
final class CommandSupport {
  private static final Logger log = LoggerFactory.getLogger(CommandSupport.class);

  private CommandSupport() {
    // Utility class
  }

  /** Body of a command, run against a fully wired root. */
  @FunctionalInterface
  interface Body {
    ExitCode run(CompositionRoot root, Map<String, String> args);
  }

  static ExitCode execute(String name, String usage, String helpText, String[] args, Body body) {
    CliInput input;
    Map<String, String> kv;
    try {
      input = CliInput.parse(args);
      kv = CliArgsParser.toMap(input.keyValueArgs());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(usage);
      return ExitCode.INVALID_ARGS;
    }
    if (input.help()) {
      CliPrinter.println(helpText.stripTrailing());
      return ExitCode.SUCCESS;
    }

    IntakeConfig config;
    try {
      config = loadConfig(kv);
    } catch (IOException ex) {
      log.error("Cannot read configuration: {}", ex.getMessage());
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging(config.eventsLogger());
      log.debug("Verbose logging enabled for {} command", name);
    }

    try (CompositionRoot root = new CompositionRoot(config)) {
      return body.run(root, kv);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} request: {}", name, ex.getMessage());
      CliPrinter.println(usage);
      return ExitCode.INVALID_ARGS;
    } catch (PersistenceException ex) {
      log.error("Review store failure during {}", name, ex);
      return ExitCode.PERSISTENCE_FAILED;
    } catch (RuntimeException ex) {
      log.error("{} command failed", name, ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  /**
   * Merges defaults, the optional YAML file, and CLI overrides into a validated configuration.
   *
   * @param kv parsed arguments; the config path entry is removed
   * @return validated configuration
   * @throws IOException if the YAML file is missing or unreadable
   */
  static IntakeConfig loadConfig(Map<String, String> kv) throws IOException {
    String configPath = CliArgsParser.extractConfigPath(kv);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path path;
      try {
        path = Path.of(configPath);
      } catch (InvalidPathException ex) {
        throw new IllegalArgumentException("config is not a valid path: " + configPath, ex);
      }
      yaml = YamlConfigLoader.load(path, YamlConfigLoader.INTAKE_SECTION);
      if (yaml.isEmpty()) {
        throw new IOException("config file not found: " + path);
      }
    }
    Map<String, String> merged =
        ConfigMerger.buildEffectiveConfig(yaml, kv, IntakeConfig.defaultsAsMap(), log::warn);
    return IntakeConfig.fromMap(merged);
  }
}
