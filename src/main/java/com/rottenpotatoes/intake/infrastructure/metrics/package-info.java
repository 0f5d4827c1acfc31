/**
 * OpenTelemetry-backed implementations of {@link com.rottenpotatoes.intake.application.port.MetricsPort}.
 *
 * @since 0.1.0
 */
package com.rottenpotatoes.intake.infrastructure.metrics;
