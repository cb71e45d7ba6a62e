package org.waabox.confluo.stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link ChangeStreamException}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class ChangeStreamExceptionTest {

  @Test
  void whenResolvingCode_givenStreamException_shouldUseItsCode() {
    final IOException io = new IOException("reset");
    final ChangeStreamException e =
        new ChangeStreamException("unavailable", "backend down", io);

    assertEquals("unavailable", ChangeStreamException.codeOf(e));
    assertEquals("backend down", e.getMessage());
    assertSame(io, e.getCause());
  }

  @Test
  void whenResolvingCode_givenOtherThrowable_shouldBeUnknown() {
    assertEquals("unknown",
        ChangeStreamException.codeOf(new IllegalStateException("boom")));
  }

  @Test
  void whenCreating_givenNullCode_shouldThrow() {
    assertThrows(NullPointerException.class, () ->
        new ChangeStreamException(null, "message")
    );
  }
}
