package org.waabox.confluo.stream;

/**
 * The kind of change a {@link ChangeRecord} describes.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum ChangeType {

  /** A document entered the watched result set. */
  ADDED("added"),

  /** A document in the watched result set changed. */
  MODIFIED("modified"),

  /** A document left the watched result set. */
  REMOVED("removed");

  /** The lowercase name used in delivery envelopes. */
  private final String wireName;

  ChangeType(final String theWireName) {
    wireName = theWireName;
  }

  /**
   * Returns the lowercase name of this change type, as carried by the
   * delivery envelopes.
   *
   * @return the wire name, never null
   */
  public String wireName() {
    return wireName;
  }
}
