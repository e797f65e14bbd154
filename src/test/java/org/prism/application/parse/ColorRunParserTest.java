package org.prism.application.parse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.prism.domain.color.LabelMap;
import org.prism.domain.color.LabelMapValidator;
import org.prism.domain.error.MalformedDocumentException;
import org.prism.domain.error.UnresolvedColorException;
import org.prism.domain.transcript.Transcript;
import org.prism.domain.transcript.Turn;
import org.prism.infrastructure.markup.RtfPlainTextConverter;
import org.prism.testutil.Fixtures;
import org.prism.testutil.RecordingMetricsPort;

class ColorRunParserTest {

  @Test
  void parsesFixtureIntoAlternatingTurns() throws Exception {
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    long[] ticks = {1_000L, 4_500L};
    int[] call = {0};
    ColorRunParser parser = new ColorRunParser(new RtfPlainTextConverter(), metrics, () -> ticks[call[0]++]);

    Transcript transcript = parser.parse(Fixtures.MEGAN, Fixtures.read(Fixtures.MEGAN), labels());

    List<Turn> turns = transcript.turns();
    assertEquals(Fixtures.MEGAN, transcript.documentName());
    assertEquals(List.of("Expert", "AI", "Expert"), turns.stream().map(Turn::label).toList());
    assertTrue(turns.get(0).text().startsWith("You believe this would be confrontational."));
    assertTrue(turns.get(0).text().endsWith("I am inviting her.\n"));
    assertTrue(turns.get(1).text().startsWith("I appreciate your perspective, and it\u2019s great"));
    assertTrue(turns.get(1).text().endsWith("better foster that sense of safety?"));
    assertTrue(turns.get(2).text().startsWith("\u00A0I think you may be misunderstanding"));
    assertTrue(turns.get(2).text().endsWith("help her look under defenses."));

    assertEquals(3, metrics.count("parse.turns.emitted"));
    assertEquals(List.of(3_500L), metrics.observed("parse.latencyNanos"));
  }

  @Test
  void noTurnTextContainsMarkupOrMarkers() throws Exception {
    ColorRunParser parser = new ColorRunParser(new RtfPlainTextConverter());

    Transcript transcript = parser.parse(Fixtures.TAMARA, Fixtures.read(Fixtures.TAMARA), labels());

    assertEquals(List.of("Expert", "AI", "Expert", "AI", "Expert"),
        transcript.turns().stream().map(Turn::label).toList());
    for (Turn turn : transcript.turns()) {
      assertTrue(turn.text().indexOf('\\') < 0, turn.text());
      assertTrue(turn.text().chars().noneMatch(c -> c < 0x20 && c != '\n'), turn.text());
    }
    assertEquals("\n\nI wonder what risks you run into when you explore right away without finding out if the "
        + "patient is willing to explore? Isn't there a risk that the therapy begins with your will and not "
        + "the will of the patient?\n", transcript.turns().get(0).text());
  }

  @Test
  void emptyLabelMapStillSplitsByColor() throws Exception {
    ColorRunParser parser = new ColorRunParser(new RtfPlainTextConverter());

    Transcript transcript = parser.parse(Fixtures.MEGAN, Fixtures.read(Fixtures.MEGAN), LabelMap.empty());

    assertEquals(3, transcript.turns().size());
    assertTrue(transcript.turns().stream().allMatch(turn -> turn.label().isEmpty()));
  }

  @Test
  void unmappedColorFailsTheDocument() throws Exception {
    ColorRunParser parser = new ColorRunParser(new RtfPlainTextConverter());
    LabelMap expertOnly = LabelMapValidator.validate(Map.of("RGB(74,21,148)", "Expert"));

    UnresolvedColorException ex = assertThrows(UnresolvedColorException.class,
        () -> parser.parse(Fixtures.MEGAN, Fixtures.read(Fixtures.MEGAN), expertOnly));
    assertEquals(4, ex.slot());
  }

  @Test
  void documentWithoutColorTableIsMalformed() {
    ColorRunParser parser = new ColorRunParser(new RtfPlainTextConverter());
    assertThrows(MalformedDocumentException.class,
        () -> parser.parse("plain.rtf", "{\\rtf1\\ansi plain text}", LabelMap.empty()));
  }

  @Test
  void colorTableTrailingBytesAreNotReadAsMarkers() throws Exception {
    ColorRunParser parser = new ColorRunParser(new RtfPlainTextConverter());
    String markup = "{\\rtf1{\\colortbl;\\red74\\green21\\blue148;\\red11\\green93\\blue162;}\\cf1 Hi\\cf2 Hello}";

    Transcript transcript = parser.parse("x.rtf", markup, labels());

    assertEquals(List.of(new Turn("Expert", "Hi"), new Turn("AI", "Hello")), transcript.turns());
  }

  @Test
  void colorChangeRightAfterUnicodeEscapeStillSplitsTurns() throws Exception {
    ColorRunParser parser = new ColorRunParser(new RtfPlainTextConverter());
    String markup = "{\\rtf1{\\colortbl;\\red1\\green1\\blue1;\\red2\\green2\\blue2;}"
        + "\\cf1 Hello\\u8217\\cf2 World}";
    LabelMap labels = LabelMapValidator.validate(Map.of("RGB(1,1,1)", "A", "RGB(2,2,2)", "B"));

    Transcript transcript = parser.parse("x.rtf", markup, labels);

    assertEquals(List.of(new Turn("A", "Hello\u2019"), new Turn("B", "World")), transcript.turns());
    assertTrue(transcript.turns().stream().noneMatch(t -> t.text().contains("cf2")));
  }

  static LabelMap labels() throws Exception {
    Map<String, String> raw = new LinkedHashMap<>();
    raw.put("RGB(74,21,148)", "Expert");
    raw.put("RGB(11,93,162)", "AI");
    return LabelMapValidator.validate(raw);
  }
}
