package org.prism.domain.color;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.prism.domain.error.InvalidLabelMapException;

class LabelMapValidatorTest {

  @Test
  void acceptsBothGrammarsAndKeepsEntryOrder() throws Exception {
    Map<String, String> raw = new LinkedHashMap<>();
    raw.put("RGB(74,21,148)", "Expert");
    raw.put("#0B5DA2", "AI");

    LabelMap labels = LabelMapValidator.validate(raw);

    assertEquals(2, labels.size());
    assertEquals(Optional.of("Expert"), labels.label(new Rgb(74, 21, 148)));
    assertEquals(Optional.of("AI"), labels.label(new Rgb(11, 93, 162)));
    assertEquals(List.of(new Rgb(74, 21, 148), new Rgb(11, 93, 162)), List.copyOf(labels.asMap().keySet()));
  }

  @Test
  void emptyOrNullMapIsLegal() throws Exception {
    assertTrue(LabelMapValidator.validate(Map.of()).isEmpty());
    assertTrue(LabelMapValidator.validate(null).isEmpty());
  }

  @Test
  void rejectsInvalidColorNamingTheEntry() {
    InvalidLabelMapException ex = assertThrows(InvalidLabelMapException.class,
        () -> LabelMapValidator.validate(Map.of("RGB(300,0,0)", "Expert")));
    assertEquals("RGB(300,0,0)=Expert", ex.entry());
  }

  @Test
  void rejectsNonStringKeysAndLabels() {
    Map<Object, Object> numericKey = new LinkedHashMap<>();
    numericKey.put(42, "Expert");
    assertThrows(InvalidLabelMapException.class, () -> LabelMapValidator.validate(numericKey));

    Map<Object, Object> numericLabel = new LinkedHashMap<>();
    numericLabel.put("#000000", 7);
    assertThrows(InvalidLabelMapException.class, () -> LabelMapValidator.validate(numericLabel));
  }

  @Test
  void rejectsSameColorMappedToDifferentLabels() {
    Map<String, String> raw = new LinkedHashMap<>();
    raw.put("RGB(11,93,162)", "AI");
    raw.put("#0B5DA2", "Assistant");

    InvalidLabelMapException ex =
        assertThrows(InvalidLabelMapException.class, () -> LabelMapValidator.validate(raw));
    assertTrue(ex.getMessage().contains("already mapped"), ex.getMessage());
  }

  @Test
  void toleratesSameColorWithSameLabel() throws Exception {
    Map<String, String> raw = new LinkedHashMap<>();
    raw.put("RGB(11,93,162)", "AI");
    raw.put("#0B5DA2", "AI");

    assertEquals(1, LabelMapValidator.validate(raw).size());
  }

  @Test
  void labelsMayBeEmptyButNotContainControlCharacters() throws Exception {
    assertEquals(Optional.of(""), LabelMapValidator.validate(Map.of("#000000", "")).label(new Rgb(0, 0, 0)));
    assertThrows(InvalidLabelMapException.class,
        () -> LabelMapValidator.validate(Map.of("#000000", "Ex\npert")));
  }

  @Test
  void isValidColorChecksSingleSpecs() {
    assertTrue(LabelMapValidator.isValidColor("RGB(1,2,3)"));
    assertFalse(LabelMapValidator.isValidColor("RGB(1,2,3"));
  }
}
