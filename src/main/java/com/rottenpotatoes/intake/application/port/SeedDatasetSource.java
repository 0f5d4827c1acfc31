package com.rottenpotatoes.intake.application.port;

import com.rottenpotatoes.intake.domain.review.SeedDataset;
import java.io.IOException;

/**
 * Supplies the static bootstrap dataset used to populate an empty store.
 *
 * @since 0.1.0
 */
public interface SeedDatasetSource {
  /**
   * Reads the dataset.
   *
   * @return parsed dataset
   * @throws IOException if the dataset is missing or unreadable
   * @throws IllegalArgumentException if the dataset is malformed
   */
  SeedDataset load() throws IOException;

  /**
   * Describes where the dataset is read from, for diagnostics.
   *
   * @return location description
   */
  String describe();
}
