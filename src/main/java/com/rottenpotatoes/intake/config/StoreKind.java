package com.rottenpotatoes.intake.config;

import java.util.Locale;

/**
 * Review store implementations selectable through the {@code store} key.
 *
 * @since 0.1.0
 */
public enum StoreKind {
  /** Process-local store; contents are lost on exit. */
  MEMORY,
  /** SQLite database file at {@code sqlitePath}. */
  SQLITE;

  /**
   * Parses a case-insensitive store name.
   *
   * @param raw configured value; {@code null} or blank selects {@link #MEMORY}
   * @return parsed store kind
   * @throws IllegalArgumentException if the value names no store
   */
  public static StoreKind fromString(String raw) {
    if (raw == null || raw.isBlank()) {
      return MEMORY;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "memory" -> MEMORY;
      case "sqlite" -> SQLITE;
      default -> throw new IllegalArgumentException("store must be memory or sqlite (was " + raw + ")");
    };
  }
}
