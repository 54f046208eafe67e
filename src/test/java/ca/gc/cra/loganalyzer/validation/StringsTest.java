package ca.gc.cra.loganalyzer.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrims() {
    assertEquals("value", Strings.requireNonBlank("key", "  value "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("key", "   "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("key", "a\nb"));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("key", null));
  }

  @Test
  void searchTermIsKeptVerbatim() {
    assertEquals(" 500 ", Strings.requireSearchTerm("term", " 500 ", 16));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireSearchTerm("term", "x".repeat(17), 16));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireSearchTerm("term", "tab\there", 16));
  }

  @Test
  void printableAsciiRejectsNonAscii() {
    assertEquals("team=ops", Strings.requirePrintableAscii("attrs", "team=ops", 64));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "équipe=ops", 64));
  }
}
