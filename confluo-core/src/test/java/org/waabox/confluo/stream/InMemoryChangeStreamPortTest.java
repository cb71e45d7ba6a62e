package org.waabox.confluo.stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link InMemoryChangeStreamPort}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class InMemoryChangeStreamPortTest {

  private final InMemoryChangeStreamPort port = new InMemoryChangeStreamPort();

  @Test
  void whenEmitting_givenOpenConnection_shouldPushChangesInOrder() {
    final RecordingHandler handler = new RecordingHandler();
    port.open("novel:42", "descriptor", handler);

    final int delivered = port.emit("novel:42",
        ChangeRecord.added("a", 1), ChangeRecord.removed("b", null));

    assertEquals(1, delivered);
    assertEquals(1, handler.emissions.size());
    assertEquals("a", handler.emissions.get(0).get(0).id());
    assertEquals(ChangeType.REMOVED, handler.emissions.get(0).get(1).type());
  }

  @Test
  void whenEmitting_givenNoConnection_shouldReachNobody() {
    assertEquals(0, port.emit("novel:42", ChangeRecord.added("a", 1)));
    assertFalse(port.isOpen("novel:42"));
  }

  @Test
  void whenClosing_givenHandleClosedTwice_shouldCountOnce() {
    final RecordingHandler handler = new RecordingHandler();
    final StreamHandle handle = port.open("novel:42", null, handler);

    handle.close();
    handle.close();

    assertFalse(port.isOpen("novel:42"));
    assertEquals(1, port.openCount("novel:42"));
    assertEquals(1, port.closeCount("novel:42"));
    assertEquals(0, port.emit("novel:42", ChangeRecord.added("a", 1)));
  }

  @Test
  void whenFailing_givenOpenConnection_shouldTerminateAndNotify() {
    final RecordingHandler handler = new RecordingHandler();
    final StreamHandle handle = port.open("novel:42", null, handler);
    final ChangeStreamException cause =
        new ChangeStreamException("unavailable", "backend down");

    assertEquals(1, port.fail("novel:42", cause));

    assertSame(cause, handler.error);
    assertFalse(port.isOpen("novel:42"));
    assertEquals(1, port.closeCount("novel:42"));

    handle.close();
    assertEquals(1, port.closeCount("novel:42"));
    assertEquals(0, port.fail("novel:42", cause));
  }

  @Test
  void whenOpening_givenSeveralKeys_shouldKeepThemApart() {
    final RecordingHandler first = new RecordingHandler();
    final RecordingHandler second = new RecordingHandler();
    port.open("novel:1", null, first);
    port.open("novel:2", null, second);

    port.emit("novel:1", ChangeRecord.modified("x", "y"));

    assertEquals(1, first.emissions.size());
    assertTrue(second.emissions.isEmpty());
    assertTrue(port.isOpen("novel:2"));
  }

  /** Records what a connection receives. */
  private static final class RecordingHandler implements ChangeStreamHandler {

    private final List<List<ChangeRecord>> emissions = new ArrayList<>();

    private Throwable error;

    @Override
    public void onChanges(final List<ChangeRecord> changes) {
      emissions.add(changes);
    }

    @Override
    public void onError(final Throwable cause) {
      error = cause;
    }
  }
}
