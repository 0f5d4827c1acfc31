/**
 * JDBC review store on SQLite.
 *
 * @since 0.1.0
 */
package com.rottenpotatoes.intake.infrastructure.persistence.jdbc;
