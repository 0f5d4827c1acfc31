/**
 * <strong>Purpose:</strong> Configuration loading and composition for the intake service.
 * <p><strong>Pipeline role:</strong> Merges defaults, YAML, and CLI overrides into an {@link
 * com.rottenpotatoes.intake.config.IntakeConfig} and wires adapters to use cases in
 * {@link com.rottenpotatoes.intake.config.CompositionRoot}.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable after construction.</p>
 * <p><strong>Security:</strong> Validation rejects control characters and non-HTTP sink endpoints.</p>
 *
 * @since 0.1.0
 */
package com.rottenpotatoes.intake.config;
