package org.prism.infrastructure.persistence;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.StringWriter;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.prism.domain.transcript.Transcript;
import org.prism.domain.transcript.Turn;

class ScriptTranscriptAdapterTest {

  @Test
  void prefixesLabelsAndTrimsTrailingWhitespace() throws Exception {
    StringWriter out = new StringWriter();
    try (ScriptTranscriptAdapter adapter = new ScriptTranscriptAdapter(out, false)) {
      adapter.persist(new Transcript("x.rtf", List.of(
          new Turn("Expert", "\n\nFirst point.\n"),
          new Turn("AI", "Reply.  "),
          new Turn("", "Preamble"))));
    }
    assertEquals("Expert: \n\nFirst point.\nAI: Reply.\nPreamble\n", out.toString());
  }
}
