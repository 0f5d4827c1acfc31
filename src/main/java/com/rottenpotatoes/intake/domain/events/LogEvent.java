package com.rottenpotatoes.intake.domain.events;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable structured event: a fixed envelope plus caller-supplied context fields.
 *
 * <p><strong>Why:</strong> Downstream consumers index events by field name, so the envelope keys
 * ({@code timestamp}, {@code level}, {@code message}, {@code logger}) must never be overwritten by
 * call-site context. A context field whose name matches a reserved key (case-insensitive) is renamed
 * to {@code ctx_<name>}; fields with {@code null} names are dropped. Field order is preserved.</p>
 * <p><strong>Thread-safety:</strong> Immutable; the field map is an unmodifiable copy.</p>
 *
 * @param timestamp event time in UTC; never {@code null}
 * @param level severity; never {@code null}
 * @param message human-readable message; never {@code null}
 * @param logger logger identity of the emitter; never {@code null}
 * @param fields sanitized context fields; never {@code null}, values may be {@code null}
 * @since 0.1.0
 */
public record LogEvent(
    Instant timestamp,
    EventLevel level,
    String message,
    String logger,
    Map<String, Object> fields) {

  /** Envelope key for the event timestamp. */
  public static final String TIMESTAMP = "timestamp";
  /** Envelope key for the severity. */
  public static final String LEVEL = "level";
  /** Envelope key for the message. */
  public static final String MESSAGE = "message";
  /** Envelope key for the logger identity. */
  public static final String LOGGER = "logger";
  /** Prefix applied to context fields that collide with envelope keys. */
  public static final String COLLISION_PREFIX = "ctx_";

  private static final Set<String> RESERVED = Set.of(TIMESTAMP, LEVEL, MESSAGE, LOGGER);

  /**
   * Validates the envelope and sanitizes the context fields.
   */
  public LogEvent {
    timestamp = Objects.requireNonNull(timestamp, "timestamp");
    level = Objects.requireNonNull(level, "level");
    message = Objects.requireNonNull(message, "message");
    logger = Objects.requireNonNull(logger, "logger");
    fields = sanitize(fields);
  }

  /**
   * Returns whether {@code name} is one of the envelope keys.
   *
   * @param name candidate field name
   * @return {@code true} when reserved
   */
  public static boolean isReserved(String name) {
    return name != null && RESERVED.contains(name.toLowerCase(Locale.ROOT));
  }

  /**
   * Flattens the envelope and the context fields into a single ordered document.
   *
   * @return new mutable map with envelope keys first
   */
  public Map<String, Object> toDocument() {
    Map<String, Object> document = new LinkedHashMap<>();
    document.put(TIMESTAMP, timestamp.toString());
    document.put(LEVEL, level.name());
    document.put(MESSAGE, message);
    document.put(LOGGER, logger);
    document.putAll(fields);
    return document;
  }

  private static Map<String, Object> sanitize(Map<String, ?> raw) {
    if (raw == null || raw.isEmpty()) {
      return Map.of();
    }
    Map<String, Object> clean = new LinkedHashMap<>();
    for (Map.Entry<String, ?> entry : raw.entrySet()) {
      String key = entry.getKey();
      if (key == null) {
        continue;
      }
      String effective = key;
      while (isReserved(effective) || (!effective.equals(key) && raw.containsKey(effective))) {
        effective = COLLISION_PREFIX + effective;
      }
      clean.put(effective, entry.getValue());
    }
    return Collections.unmodifiableMap(clean);
  }
}
