package org.waabox.confluo;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link SubscriptionOptions}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class SubscriptionOptionsTest {

  @Test
  void whenUsingDefaults_shouldMatchDocumentedValues() {
    final SubscriptionOptions options = SubscriptionOptions.defaults();

    assertTrue(options.targetedQuery());
    assertTrue(options.batchUpdates());
    assertEquals(Duration.ofMillis(100), options.debounce());
    assertEquals(3, options.maxRetries());
    assertEquals(Duration.ofMinutes(5), options.cleanupTimeout());
  }

  @Test
  void whenDerivingWithToBuilder_givenOneOverride_shouldKeepTheRest() {
    final SubscriptionOptions base = SubscriptionOptions.builder()
        .debounce(Duration.ofMillis(250))
        .maxRetries(1)
        .build();

    final SubscriptionOptions derived = base.toBuilder()
        .batchUpdates(false)
        .build();

    assertFalse(derived.batchUpdates());
    assertEquals(Duration.ofMillis(250), derived.debounce());
    assertEquals(1, derived.maxRetries());
    assertNotEquals(base, derived);
    assertEquals(base, derived.toBuilder().batchUpdates(true).build());
    assertEquals(base.hashCode(),
        derived.toBuilder().batchUpdates(true).build().hashCode());
  }

  @Test
  void whenBuilding_givenZeroDebounce_shouldAcceptIt() {
    final SubscriptionOptions options = SubscriptionOptions.builder()
        .debounce(Duration.ZERO)
        .maxRetries(0)
        .build();

    assertEquals(Duration.ZERO, options.debounce());
    assertEquals(0, options.maxRetries());
  }

  @Test
  void whenBuilding_givenNegativeDebounce_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        SubscriptionOptions.builder().debounce(Duration.ofMillis(-1))
    );
  }

  @Test
  void whenBuilding_givenNegativeRetries_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        SubscriptionOptions.builder().maxRetries(-1)
    );
  }

  @Test
  void whenBuilding_givenZeroCleanupTimeout_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        SubscriptionOptions.builder().cleanupTimeout(Duration.ZERO)
    );
  }
}
