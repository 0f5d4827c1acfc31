/**
 * Structured operational events emitted by the intake core and fanned out to local and remote sinks.
 *
 * @since 0.1.0
 */
package com.rottenpotatoes.intake.domain.events;
