/**
 * <strong>Purpose:</strong> Classifier artifact adapters: the JSON TF-IDF/logistic-regression loader, the
 * resulting immutable classifier, and the directory-ancestor version tag resolver.
 * <p><strong>Concurrency:</strong> Loaded classifiers hold no mutable state and are shared by all request
 * threads.</p>
 *
 * @since 0.1.0
 */
package com.rottenpotatoes.intake.infrastructure.model;
