/**
 * Movie, review, and freshness score values shared by the intake use cases and persistence adapters.
 *
 * @since 0.1.0
 */
package com.rottenpotatoes.intake.domain.review;
