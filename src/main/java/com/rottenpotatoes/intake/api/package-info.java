/**
 * CLI entry points for review intake: submit, score, catalog reads, seeding, and model status.
 * <p><strong>Role:</strong> Adapter layer on the driving side; stands in for the HTTP routing layer. Parses
 * {@code key=value} arguments, merges configuration, builds a
 * {@link com.rottenpotatoes.intake.config.CompositionRoot}, invokes one use case, and prints JSON.</p>
 * <p><strong>Concurrency:</strong> Each invocation runs on the calling thread.</p>
 * <p><strong>Security:</strong> Rejects control characters in arguments; review text is never logged in full.</p>
 */
package com.rottenpotatoes.intake.api;
