/**
 * <strong>Purpose:</strong> Adapters implementing the intake ports: classifier artifacts, review stores, event
 * sinks, seed sources, metrics, clocks, and executors.
 * <p><strong>Pipeline role:</strong> Outer ring of the hexagon; wired together by
 * {@link com.rottenpotatoes.intake.config.CompositionRoot}.</p>
 *
 * @since 0.1.0
 */
package com.rottenpotatoes.intake.infrastructure;
