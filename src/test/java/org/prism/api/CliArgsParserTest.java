package org.prism.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {

  @Test
  void splitsOnFirstEqualsAndKeepsLabelKeys() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {
        "in=./cases", "labels=RGB(74,21,148)=Expert;#0B5DA2=AI", "labels.RGB(1, 2, 3)=Client", "out="});

    assertEquals("./cases", map.get("in"));
    assertEquals("RGB(74,21,148)=Expert;#0B5DA2=AI", map.get("labels"));
    assertEquals("Client", map.get("labels.RGB(1, 2, 3)"));
    assertEquals("", map.get("out"));
  }

  @Test
  void skipsBlankArguments() {
    assertEquals(Map.of("a", "b"), CliArgsParser.toMap(new String[] {" ", null, "a=b"}));
    assertEquals(Map.of(), CliArgsParser.toMap(null));
  }

  @Test
  void rejectsMalformedArguments() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"novalue"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=x"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"bad key=x"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"in=a\u0007b"}));
  }
}
