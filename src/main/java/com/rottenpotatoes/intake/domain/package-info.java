/**
 * Core domain model for the review intake classify -> persist -> report flow.
 * <p><strong>Role:</strong> Domain layer values describing movies, reviews, scores, predictions, and
 * operational events without infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable unless noted; safe to share across request threads.</p>
 * <p><strong>Metrics:</strong> Domain attributes feed tagging on {@code intake.*}, {@code events.*}, and
 * {@code seed.*} metrics.</p>
 * <p><strong>Security:</strong> Review text is user supplied; callers truncate it before it reaches logs.</p>
 */
package com.rottenpotatoes.intake.domain;
