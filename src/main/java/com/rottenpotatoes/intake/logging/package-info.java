/**
 * <strong>Purpose:</strong> Logging helpers for the intake CLI: verbosity control and log hygiene for review text.
 * <p><strong>Concurrency:</strong> Stateless utilities.</p>
 *
 * @since 0.1.0
 */
package com.rottenpotatoes.intake.logging;
