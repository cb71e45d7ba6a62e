package org.waabox.confluo.delivery;

import java.util.Objects;

import org.waabox.confluo.stream.ChangeRecord;
import org.waabox.confluo.stream.ChangeType;

/**
 * A single change.
 *
 * @param changeType the kind of change, never null
 * @param item       the document content, may be null
 * @param id         the document identifier, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ChangeDelivery(ChangeType changeType, Object item, String id)
    implements Delivery {

  /**
   * Validates the record components.
   *
   * @throws NullPointerException if changeType or id is null
   */
  public ChangeDelivery {
    Objects.requireNonNull(changeType, "changeType must not be null");
    Objects.requireNonNull(id, "id must not be null");
  }

  /**
   * Creates the envelope of a stream change.
   *
   * @param change the change, never null
   *
   * @return the envelope, never null
   */
  public static ChangeDelivery of(final ChangeRecord change) {
    return new ChangeDelivery(change.type(), change.payload(), change.id());
  }

  /** {@inheritDoc} */
  @Override
  public String type() {
    return changeType.wireName();
  }
}
