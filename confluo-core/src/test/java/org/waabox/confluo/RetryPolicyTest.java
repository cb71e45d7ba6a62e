package org.waabox.confluo;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link RetryPolicy}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class RetryPolicyTest {

  @Test
  void whenUsingDefault_shouldDoubleFromOneSecond() {
    final RetryPolicy policy = RetryPolicy.defaultPolicy();

    assertEquals(Duration.ofSeconds(1), policy.baseBackoff());
    assertEquals(Duration.ofMinutes(5), policy.maxBackoff());
    assertEquals(Duration.ofSeconds(2), policy.backoffFor(1));
    assertEquals(Duration.ofSeconds(4), policy.backoffFor(2));
    assertEquals(Duration.ofSeconds(8), policy.backoffFor(3));
  }

  @Test
  void whenComputingBackoff_givenLargeRetry_shouldCapAtMax() {
    final RetryPolicy policy = RetryPolicy.of(Duration.ofSeconds(1),
        Duration.ofSeconds(30));

    assertEquals(Duration.ofSeconds(16), policy.backoffFor(4));
    assertEquals(Duration.ofSeconds(30), policy.backoffFor(5));
    assertEquals(Duration.ofSeconds(30), policy.backoffFor(64));
  }

  @Test
  void whenCreating_givenBaseAboveDefaultCap_shouldUseBaseAsCap() {
    final RetryPolicy policy = RetryPolicy.of(Duration.ofMinutes(10));

    assertEquals(Duration.ofMinutes(10), policy.maxBackoff());
    assertEquals(Duration.ofMinutes(10), policy.backoffFor(1));
  }

  @Test
  void whenComputingBackoff_givenZeroRetry_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        RetryPolicy.defaultPolicy().backoffFor(0)
    );
  }

  @Test
  void whenCreating_givenNullBackoff_shouldThrow() {
    assertThrows(NullPointerException.class, () ->
        RetryPolicy.of(null)
    );
  }

  @Test
  void whenCreating_givenZeroBackoff_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        RetryPolicy.of(Duration.ZERO)
    );
  }

  @Test
  void whenCreating_givenCapBelowBase_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        RetryPolicy.of(Duration.ofSeconds(10), Duration.ofSeconds(5))
    );
  }
}
