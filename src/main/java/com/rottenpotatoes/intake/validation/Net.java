package com.rottenpotatoes.intake.validation;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Network endpoint validation utilities for remote event sinks.
 *
 * @since 0.1.0
 */
public final class Net {

  private Net() {
    // Utility
  }

  /**
   * Validates an absolute {@code http}/{@code https} endpoint with a host.
   *
   * @param name option name for diagnostics
   * @param value candidate URL
   * @return parsed URI
   * @throws IllegalArgumentException if the URL is malformed, relative, hostless, or not HTTP(S)
   */
  public static URI validateHttpEndpoint(String name, String value) {
    String sanitized = Strings.requireNonBlank(name, value);
    URI uri;
    try {
      uri = new URI(sanitized);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException(name + " is not a valid URI: " + ex.getMessage(), ex);
    }
    String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
    if (!scheme.equals("http") && !scheme.equals("https")) {
      throw new IllegalArgumentException(name + " must use http or https (was " + sanitized + ")");
    }
    if (uri.getHost() == null || uri.getHost().isBlank()) {
      throw new IllegalArgumentException(name + " must include a host (was " + sanitized + ")");
    }
    if (uri.getPort() != -1) {
      Numbers.requireRange(name + " port", uri.getPort(), 1, 65535);
    }
    return uri;
  }
}
