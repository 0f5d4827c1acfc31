/**
 * Values produced by the classifier capability.
 *
 * @since 0.1.0
 */
package com.rottenpotatoes.intake.domain.model;
