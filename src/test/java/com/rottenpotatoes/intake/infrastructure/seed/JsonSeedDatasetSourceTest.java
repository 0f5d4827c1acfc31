package com.rottenpotatoes.intake.infrastructure.seed;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rottenpotatoes.intake.domain.review.SeedDataset;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonSeedDatasetSourceTest {
  private final ObjectMapper mapper = new ObjectMapper();

  @TempDir Path tempDir;

  @Test
  void bundledDatasetLoadsFromClasspath() throws IOException {
    SeedDataset dataset = new JsonSeedDatasetSource("classpath:/seed/movies.json", mapper).load();

    assertEquals(5, dataset.movies().size());
    assertEquals(11, dataset.reviews().size());
    assertEquals("The Shawshank Redemption", dataset.movies().get(0).name());
  }

  @Test
  void fileWithoutReviewsIsAccepted() throws IOException {
    Path file = tempDir.resolve("movies.json");
    Files.writeString(file, "{\"movies\": [{\"id\": 7, \"name\": \"Heat\"}]}");

    SeedDataset dataset = new JsonSeedDatasetSource(file.toString(), mapper).load();

    assertEquals(1, dataset.movies().size());
    assertEquals("", dataset.movies().get(0).description());
    assertTrue(dataset.reviews().isEmpty());
  }

  @Test
  void malformedEntriesAreReportedAsIoErrors() throws IOException {
    Path file = tempDir.resolve("bad.json");
    Files.writeString(file, """
        {"movies": [{"id": 1, "name": "A"}], "reviews": [{"movieId": 1, "text": "x", "positive": "yes"}]}
        """);

    IOException ex = assertThrows(IOException.class, () -> new JsonSeedDatasetSource(file.toString(), mapper).load());
    assertTrue(ex.getMessage().contains("positive"), ex.getMessage());
  }

  @Test
  void missingSourcesFail() {
    assertThrows(NoSuchFileException.class,
        () -> new JsonSeedDatasetSource(tempDir.resolve("none.json").toString(), mapper).load());
    assertThrows(IOException.class, () -> new JsonSeedDatasetSource("classpath:/seed/none.json", mapper).load());
  }
}
