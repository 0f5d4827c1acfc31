/**
 * <strong>Purpose:</strong> Application use cases for review intake: submission, scoring, and catalog reads.
 * <p><strong>Pipeline role:</strong> Orchestrates the classifier, persistence, and event ports; exposed to the
 * outer surface (CLI or routing layer) as synchronous request/response operations.</p>
 * <p><strong>Concurrency:</strong> Use cases hold only immutable collaborators and are safe to share across
 * request threads.</p>
 * <p><strong>Performance:</strong> One classifier call and one store write per submission; two counts per score.</p>
 * <p><strong>Metrics:</strong> Emits {@code intake.submit.*} and {@code intake.score.*} through
 * {@link com.rottenpotatoes.intake.application.port.MetricsPort}.</p>
 * <p><strong>Security:</strong> Review text is user supplied; diagnostics only carry bounded excerpts.</p>
 *
 * @since 0.1.0
 */
package com.rottenpotatoes.intake.application.pipeline;
