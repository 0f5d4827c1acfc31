/**
 * Clock adapters.
 *
 * @since 0.1.0
 */
package com.rottenpotatoes.intake.infrastructure.time;
