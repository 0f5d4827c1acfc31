/**
 * <strong>Purpose:</strong> Ports defining the classify -> persist -> report contracts of the intake core.
 * <p><strong>Pipeline role:</strong> Application layer boundary; adapters implement these interfaces to
 * integrate artifacts, stores, event sinks, clocks, and metrics backends.</p>
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe unless documented otherwise;
 * request threads invoke them concurrently.</p>
 * <p><strong>Observability:</strong> Ports expose hooks for metrics/events but do not prescribe implementations.</p>
 * <p><strong>Security:</strong> Port boundaries assume validated inputs from the configuration and CLI modules.</p>
 *
 * @since 0.1.0
 */
package com.rottenpotatoes.intake.application.port;
