package ca.gc.cra.ingest.domain.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

import org.junit.jupiter.api.Test;

class ControlCharsTest {

  @Test
  void doublesBackslashBeforeLiteralN() {
    assertEquals("hello\\\\nworld", ControlChars.escapeJsonControlChars("hello\\nworld"));
  }

  @Test
  void doublesBackslashBeforeLiteralR() {
    assertEquals("a\\\\rb", ControlChars.escapeJsonControlChars("a\\rb"));
  }

  @Test
  void handlesCarriageReturnLineFeedPair() {
    assertEquals("line\\\\r\\\\n", ControlChars.escapeJsonControlChars("line\\r\\n"));
  }

  @Test
  void leavesRealControlCharactersAlone() {
    assertEquals("a\nb\rc", ControlChars.escapeJsonControlChars("a\nb\rc"));
  }

  @Test
  void leavesOtherEscapesAlone() {
    assertEquals("tab\\there", ControlChars.escapeJsonControlChars("tab\\there"));
  }

  @Test
  void returnsInputWithoutBackslashUnchanged() {
    String text = "plain text";
    assertSame(text, ControlChars.escapeJsonControlChars(text));
    assertEquals("", ControlChars.escapeJsonControlChars(""));
    assertNull(ControlChars.escapeJsonControlChars(null));
  }

  @Test
  void applyingTwiceEscapesAgain() {
    String once = ControlChars.escapeJsonControlChars("x\\ny");
    assertEquals("x\\\\\\ny", ControlChars.escapeJsonControlChars(once));
  }
}
