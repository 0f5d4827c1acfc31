package com.rottenpotatoes.intake.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Writes command results to standard output, independent of the logging backend.
 *
 * @since 0.1.0
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static final ObjectMapper JSON = new ObjectMapper();
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  public static void println(String message) {
    writer().println(message);
  }

  /**
   * Prints a value as a single line of JSON.
   *
   * @param value maps, lists, and scalars
   * @throws IllegalStateException if the value cannot be serialized
   */
  public static void printJson(Object value) {
    try {
      writer().println(JSON.writeValueAsString(value));
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Cannot render command output as JSON", ex);
    }
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }

  private static PrintWriter writer() {
    return override != null ? override : STDOUT;
  }
}
