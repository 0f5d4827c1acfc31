/**
 * <strong>Purpose:</strong> Input validation helpers shared by configuration loading and the CLI.
 * <p><strong>Concurrency:</strong> Stateless utilities; thread-safe.</p>
 * <p><strong>Observability:</strong> Failures raise {@link java.lang.IllegalArgumentException} naming the offending key.</p>
 *
 * @since 0.1.0
 */
package com.rottenpotatoes.intake.validation;
