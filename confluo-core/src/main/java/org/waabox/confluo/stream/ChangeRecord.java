package org.waabox.confluo.stream;

import java.util.Objects;

/**
 * A single change pushed by a live change-stream connection.
 *
 * @param type    the kind of change, never null
 * @param id      the identifier of the changed document, never null
 * @param payload the document content after the change, may be null for
 *                removals
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ChangeRecord(ChangeType type, String id, Object payload) {

  /**
   * Validates the record components.
   *
   * @throws NullPointerException if type or id is null
   */
  public ChangeRecord {
    Objects.requireNonNull(type, "type must not be null");
    Objects.requireNonNull(id, "id must not be null");
  }

  /**
   * Creates an {@link ChangeType#ADDED} record.
   *
   * @param id      the document identifier, never null
   * @param payload the document content
   *
   * @return a new record, never null
   */
  public static ChangeRecord added(final String id, final Object payload) {
    return new ChangeRecord(ChangeType.ADDED, id, payload);
  }

  /**
   * Creates a {@link ChangeType#MODIFIED} record.
   *
   * @param id      the document identifier, never null
   * @param payload the document content
   *
   * @return a new record, never null
   */
  public static ChangeRecord modified(final String id, final Object payload) {
    return new ChangeRecord(ChangeType.MODIFIED, id, payload);
  }

  /**
   * Creates a {@link ChangeType#REMOVED} record.
   *
   * @param id      the document identifier, never null
   * @param payload the last known document content, may be null
   *
   * @return a new record, never null
   */
  public static ChangeRecord removed(final String id, final Object payload) {
    return new ChangeRecord(ChangeType.REMOVED, id, payload);
  }
}
