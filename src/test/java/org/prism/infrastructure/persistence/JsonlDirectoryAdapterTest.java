package org.prism.infrastructure.persistence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.prism.domain.transcript.Transcript;
import org.prism.domain.transcript.Turn;

class JsonlDirectoryAdapterTest {

  @TempDir Path dir;

  @Test
  void writesOneFilePerDocumentNamedAfterItsStem() throws Exception {
    Path out = dir.resolve("jsonl");
    try (JsonlDirectoryAdapter adapter = new JsonlDirectoryAdapter(out)) {
      adapter.persist(new Transcript("meganDenial.rtf", List.of(new Turn("Expert", "Hi"))));
      adapter.persist(new Transcript("tamaraDenial.rtf", List.of(new Turn("AI", "Yo"), new Turn("Expert", "Ok"))));
    }

    assertEquals(List.of("{\"Expert\":\"Hi\"}"), Files.readAllLines(out.resolve("meganDenial.jsonl")));
    assertEquals(List.of("{\"AI\":\"Yo\"}", "{\"Expert\":\"Ok\"}"),
        Files.readAllLines(out.resolve("tamaraDenial.jsonl")));
  }

  @Test
  void noOpAdapterWritesNothing() throws Exception {
    Path out = dir.resolve("unused");
    try (NoOpTranscriptAdapter adapter = new NoOpTranscriptAdapter()) {
      adapter.persist(new Transcript("a.rtf", List.of(new Turn("AI", "x"))));
    }
    assertFalse(Files.exists(out));
  }

  @Test
  void stemKeepsDotFiles() {
    assertEquals("a.b", JsonlDirectoryAdapter.stem("a.b.rtf"));
    assertEquals(".hidden", JsonlDirectoryAdapter.stem(".hidden"));
  }
}
