/**
 * Startup-time classifier artifact discovery and the immutable model value it publishes.
 *
 * @since 0.1.0
 */
package com.rottenpotatoes.intake.application.model;
