/**
 * <strong>Purpose:</strong> Application services orchestrating artifact resolution, review ingestion,
 * score aggregation, catalog reads, and bootstrap seeding.
 * <p><strong>Pipeline role:</strong> Application layer between the CLI surface and the adapters.</p>
 * <p><strong>Concurrency:</strong> Use cases are immutable after construction and safe for concurrent calls.</p>
 * <p><strong>Observability:</strong> Emits structured events at every stage transition and {@code intake.*} metrics.</p>
 *
 * @since 0.1.0
 */
package com.rottenpotatoes.intake.application;
