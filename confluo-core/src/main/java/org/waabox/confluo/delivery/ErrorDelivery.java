package org.waabox.confluo.delivery;

import java.util.Objects;

/**
 * The change stream behind a subscription failed.
 *
 * @param message the failure description, never null
 * @param code    the machine readable error code, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ErrorDelivery(String message, String code) implements Delivery {

  /**
   * Validates the record components.
   *
   * @throws NullPointerException if message or code is null
   */
  public ErrorDelivery {
    Objects.requireNonNull(message, "message must not be null");
    Objects.requireNonNull(code, "code must not be null");
  }

  /** {@inheritDoc} */
  @Override
  public String type() {
    return "error";
  }
}
