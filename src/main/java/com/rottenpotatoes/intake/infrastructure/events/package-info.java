/**
 * <strong>Purpose:</strong> Event emitter and sink adapters: a synchronous SLF4J sink, a best-effort HTTP sink for
 * the remote search index, and the fan-out emitter that isolates them from each other and from callers.
 * <p><strong>Concurrency:</strong> All types are safe for concurrent emitters; the HTTP sink bounds its
 * outstanding requests.</p>
 * <p><strong>Metrics:</strong> {@code events.local.failed}, {@code events.remote.sent},
 * {@code events.remote.failed}, {@code events.remote.dropped}.</p>
 *
 * @since 0.1.0
 */
package com.rottenpotatoes.intake.infrastructure.events;
