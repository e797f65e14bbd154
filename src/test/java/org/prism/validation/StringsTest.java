package org.prism.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrims() {
    assertEquals("value", Strings.requireNonBlank("name", "  value "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("name", "   "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("name", "a\tb"));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("name", null));
  }

  @Test
  void requirePrintableAsciiEnforcesLengthAndRange() {
    assertEquals("team=research", Strings.requirePrintableAscii("attrs", "team=research", 32));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "abcdef", 3));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "caf\u00E9", 32));
  }

  @Test
  void labelsMayBeEmptyButNotPadded() {
    assertEquals("", Strings.requireLabel("label", ""));
    assertEquals("Expert Witness", Strings.requireLabel("label", "Expert Witness"));
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Strings.requireLabel("label", " Expert"));
    assertEquals("label must not start or end with whitespace", ex.getMessage());
    assertThrows(IllegalArgumentException.class, () -> Strings.requireLabel("label", "Ex\npert"));
  }
}
