/**
 * Startup seeding of the review store from a static dataset.
 *
 * @since 0.1.0
 */
package com.rottenpotatoes.intake.application.seed;
