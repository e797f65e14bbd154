package org.prism.infrastructure.persistence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.prism.domain.transcript.CaseRecord;
import org.prism.domain.transcript.DiscussionSet;
import org.prism.domain.transcript.SkippedDocument;
import org.prism.domain.transcript.Turn;

class DiscussionJsonAdapterTest {

  @TempDir Path dir;

  @Test
  void writesRecordsAsPrettyJsonArray() throws Exception {
    Path target = dir.resolve("out/discussions.json");
    DiscussionSet set = new DiscussionSet(
        List.of(new CaseRecord("Megan", "denial",
            List.of(new Turn("Expert", "Hi\n"), new Turn("AI", "Hello")), "meganDenial.rtf")),
        List.of(new SkippedDocument("bad.rtf", "MalformedDocumentException", "no color table")));

    new DiscussionJsonAdapter(target).persist(set);

    String json = Files.readString(target, StandardCharsets.UTF_8);
    assertTrue(json.startsWith("["), json);
    assertTrue(json.endsWith("]\n"), json);
    assertTrue(json.contains("\n"), "pretty printed");
    assertEquals(List.of("clientName", "Megan", "category", "denial", "conversation",
        "Expert", "Hi\n", "AI", "Hello"), tokens(json));
  }

  @Test
  void emptySetIsEmptyArray() throws Exception {
    Path target = dir.resolve("discussions.json");
    new DiscussionJsonAdapter(target).persist(new DiscussionSet(List.of(), List.of()));
    assertEquals(List.of(), tokens(Files.readString(target)));
    assertTrue(Files.readString(target).startsWith("["));
  }

  private static List<String> tokens(String json) throws Exception {
    List<String> values = new ArrayList<>();
    try (JsonParser parser = NdjsonTranscriptAdapter.JSON.createParser(json)) {
      JsonToken token;
      while ((token = parser.nextToken()) != null) {
        if (token == JsonToken.FIELD_NAME || token == JsonToken.VALUE_STRING) {
          values.add(parser.getText());
        }
      }
    }
    return values;
  }
}
