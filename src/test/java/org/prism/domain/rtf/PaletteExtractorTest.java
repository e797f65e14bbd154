package org.prism.domain.rtf;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.prism.domain.color.Palette;
import org.prism.domain.color.Rgb;
import org.prism.domain.error.MalformedDocumentException;
import org.prism.testutil.Fixtures;

class PaletteExtractorTest {

  @Test
  void declaredColorsOccupySlotsOneToN() throws Exception {
    String markup = "{\\rtf1{\\colortbl;\\red255\\green255\\blue255;\\red74\\green21\\blue148;"
        + "\\red255\\green255\\blue255;\\red11\\green93\\blue162;\n}\\cf2 Hi}";

    Palette palette = PaletteExtractor.extract(markup).palette();

    assertEquals(4, palette.size());
    assertEquals(Optional.of(new Rgb(255, 255, 255)), palette.color(1));
    assertEquals(Optional.of(new Rgb(74, 21, 148)), palette.color(2));
    assertEquals(Optional.of(new Rgb(255, 255, 255)), palette.color(3));
    assertEquals(Optional.of(new Rgb(11, 93, 162)), palette.color(4));
    assertTrue(palette.color(0).isEmpty(), "slot 0 is the auto color");
    assertTrue(palette.color(5).isEmpty());
  }

  @Test
  void componentsMayAppearInAnyOrder() throws Exception {
    Palette palette = PaletteExtractor.extract("{\\colortbl;\\blue3\\red1\\green2;}").palette();
    assertEquals(Optional.of(new Rgb(1, 2, 3)), palette.color(1));
  }

  @Test
  void colorDeclaredBeforeFirstSeparatorIsTreatedAsAutoSlot() throws Exception {
    Palette palette = PaletteExtractor.extract(
        "{\\rtf1{\\colortbl\\red255\\green0\\blue0;\\red0\\green0\\blue255;}x}").palette();

    assertEquals(1, palette.size());
    assertEquals(Optional.of(new Rgb(0, 0, 255)), palette.color(1));
    assertTrue(palette.color(2).isEmpty());
  }

  @Test
  void fixturePaletteIncludesTrailingEntryOnNextLine() throws Exception {
    Palette palette = PaletteExtractor.extract(Fixtures.read(Fixtures.TAMARA)).palette();
    assertEquals(5, palette.size());
    assertEquals(Optional.of(new Rgb(26, 26, 26)), palette.color(5));
  }

  @Test
  void bodyWithoutTableRemovesTheWholeGroup() throws Exception {
    PaletteExtractor.Extraction extraction =
        PaletteExtractor.extract("{\\rtf1 {\\colortbl;\\red1\\green2\\blue3;}\\cf1 hello}");

    String body = extraction.bodyWithoutTable();
    assertEquals("{\\rtf1 \\cf1 hello}", body);
    assertFalse(body.contains("colortbl"));
  }

  @Test
  void expandedColorTableIsNotMistakenForTheTable() throws Exception {
    String markup = "{\\rtf1{\\*\\expandedcolortbl;;\\cssrgb\\c1\\c2\\c3;}{\\colortbl;\\red9\\green8\\blue7;}}";
    assertEquals(Optional.of(new Rgb(9, 8, 7)), PaletteExtractor.extract(markup).palette().color(1));
  }

  @Test
  void missingTableIsMalformed() {
    assertThrows(MalformedDocumentException.class, () -> PaletteExtractor.extract("{\\rtf1 plain}"));
  }

  @Test
  void unterminatedTableIsMalformed() {
    assertThrows(MalformedDocumentException.class,
        () -> PaletteExtractor.extract("{\\rtf1{\\colortbl;\\red1\\green2\\blue3;"));
  }

  @Test
  void emptyTableIsMalformed() {
    assertThrows(MalformedDocumentException.class, () -> PaletteExtractor.extract("{\\colortbl;}"));
  }

  @Test
  void outOfRangeOrIncompleteEntriesAreMalformed() {
    assertThrows(MalformedDocumentException.class,
        () -> PaletteExtractor.extract("{\\colortbl;\\red256\\green0\\blue0;}"));
    assertThrows(MalformedDocumentException.class,
        () -> PaletteExtractor.extract("{\\colortbl;\\red1000\\green0\\blue0;}"));
    assertThrows(MalformedDocumentException.class,
        () -> PaletteExtractor.extract("{\\colortbl;\\red1\\green2;}"));
  }
}
