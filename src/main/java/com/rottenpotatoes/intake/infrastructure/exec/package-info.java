/**
 * Executor factories for background event delivery.
 *
 * @since 0.1.0
 */
package com.rottenpotatoes.intake.infrastructure.exec;
