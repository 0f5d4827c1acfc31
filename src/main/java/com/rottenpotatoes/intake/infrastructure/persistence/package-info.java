/**
 * <strong>Purpose:</strong> Review store adapters implementing
 * {@link com.rottenpotatoes.intake.application.port.PersistencePort}.
 * <p><strong>Concurrency:</strong> The in-memory store serializes access with its monitor; the JDBC store opens a
 * connection per operation and relies on SQLite locking.</p>
 * <p><strong>Failure modes:</strong> Storage errors surface as
 * {@link com.rottenpotatoes.intake.application.port.PersistenceException}.</p>
 *
 * @since 0.1.0
 */
package com.rottenpotatoes.intake.infrastructure.persistence;
