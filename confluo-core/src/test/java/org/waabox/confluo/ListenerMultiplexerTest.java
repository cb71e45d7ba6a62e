package org.waabox.confluo;

import static org.easymock.EasyMock.anyObject;
import static org.easymock.EasyMock.capture;
import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.eq;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.newCapture;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

import org.easymock.Capture;
import org.easymock.CaptureType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.waabox.confluo.delivery.ChangeDelivery;
import org.waabox.confluo.delivery.Delivery;
import org.waabox.confluo.delivery.ErrorDelivery;
import org.waabox.confluo.metrics.ConfluoMetrics;
import org.waabox.confluo.metrics.NoopConfluoMetrics;
import org.waabox.confluo.stream.ChangeRecord;
import org.waabox.confluo.stream.ChangeStreamException;
import org.waabox.confluo.stream.ChangeStreamHandler;
import org.waabox.confluo.stream.ChangeStreamPort;
import org.waabox.confluo.stream.StreamHandle;

/**
 * Tests for {@link ListenerMultiplexer}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class ListenerMultiplexerTest {

  private static final String KEY = "novel:42";

  private static final String DESCRIPTOR = "novels where id == 42";

  private final Clock clock = Clock.systemUTC();

  private final ConfluoMetrics metrics = new NoopConfluoMetrics();

  private final ReentrantLock lock = new ReentrantLock();

  private final BlockingQueue<Delivery> received = new LinkedBlockingQueue<>();

  private ScheduledExecutorService executor;

  private SubscriptionRegistry registry;

  private ChangeEventRouter router;

  private ChangeStreamPort port;

  private StreamHandle handle;

  @BeforeEach
  void setUp() {
    executor = Executors.newSingleThreadScheduledExecutor();
    registry = new SubscriptionRegistry(lock, clock);
    final CircuitBreaker deliveryBreaker = new CircuitBreaker("delivery",
        CircuitBreakerPolicy.defaultPolicy(), clock, metrics);
    final BatchAggregator aggregator = new BatchAggregator(
        BatchPolicy.defaultPolicy(), RetryPolicy.defaultPolicy(), executor,
        clock, deliveryBreaker, metrics);
    router = new ChangeEventRouter(registry, aggregator, deliveryBreaker,
        new MetricsCollector(), metrics, clock);
    port = createMock(ChangeStreamPort.class);
    handle = createMock(StreamHandle.class);

    registry.register(KEY, received::add, SubscriptionOptions.builder()
        .batchUpdates(false).build());
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void whenAcquiring_givenSameKeyTwice_shouldOpenOneConnection() {
    expect(port.open(eq(KEY), eq(DESCRIPTOR),
        anyObject(ChangeStreamHandler.class))).andReturn(handle).once();
    handle.close();
    expectLastCall().once();
    replay(port, handle);

    final ListenerMultiplexer multiplexer = multiplexer(breaker(5),
        RetryPolicy.defaultPolicy());

    multiplexer.acquire(KEY, DESCRIPTOR);
    multiplexer.acquire(KEY, DESCRIPTOR);

    assertEquals(2, multiplexer.references(KEY));
    assertEquals(1, multiplexer.activeListeners());
    assertEquals(1, multiplexer.sharedListeners());

    assertFalse(multiplexer.release(KEY));
    assertEquals(1, multiplexer.activeListeners());
    assertTrue(multiplexer.release(KEY));
    assertFalse(multiplexer.release(KEY));

    assertEquals(0, multiplexer.entryCount());
    assertEquals(0, multiplexer.activeListeners());
    verify(port, handle);
  }

  @Test
  void whenOpening_givenTransportFailure_shouldFanOutErrorAndKeepEntry()
      throws Exception {
    expect(port.open(eq(KEY), eq(DESCRIPTOR),
        anyObject(ChangeStreamHandler.class)))
        .andThrow(new ChangeStreamException("unavailable", "backend down"))
        .once();
    replay(port, handle);

    final CircuitBreaker streamBreaker = breaker(5);
    final ListenerMultiplexer multiplexer = multiplexer(streamBreaker,
        RetryPolicy.of(Duration.ofMinutes(1)));

    multiplexer.acquire(KEY, DESCRIPTOR);

    final ErrorDelivery error = assertInstanceOf(ErrorDelivery.class,
        received.poll(1, TimeUnit.SECONDS));
    assertEquals("unavailable", error.code());
    assertEquals("backend down", error.message());
    assertEquals(1, multiplexer.entryCount());
    assertEquals(0, multiplexer.activeListeners());
    assertEquals(1, streamBreaker.failures(KEY));

    assertTrue(multiplexer.release(KEY));
    assertEquals(0, streamBreaker.failures(KEY));
    verify(port, handle);
  }

  @Test
  void whenStreamFails_givenLiveSubscriptions_shouldReopenAndDropLateEvents()
      throws Exception {
    final Capture<ChangeStreamHandler> handlers =
        newCapture(CaptureType.ALL);
    expect(port.open(eq(KEY), eq(DESCRIPTOR), capture(handlers)))
        .andReturn(handle).times(2);
    handle.close();
    expectLastCall().times(2);
    replay(port, handle);

    final ListenerMultiplexer multiplexer = multiplexer(breaker(5),
        RetryPolicy.of(Duration.ofMillis(100)));
    multiplexer.acquire(KEY, DESCRIPTOR);
    final ChangeStreamHandler first = handlers.getValue();

    first.onError(new IllegalStateException("connection reset"));

    final ErrorDelivery error = assertInstanceOf(ErrorDelivery.class,
        received.poll(1, TimeUnit.SECONDS));
    assertEquals(ChangeStreamException.UNKNOWN_CODE, error.code());
    assertEquals(0, multiplexer.activeListeners());

    Await.until(() -> multiplexer.activeListeners() == 1,
        Duration.ofSeconds(2), "listener reopened");
    final List<ChangeStreamHandler> all = handlers.getValues();
    assertEquals(2, all.size());

    all.get(0).onChanges(List.of(ChangeRecord.modified("doc-1", "stale")));
    assertNull(received.poll(100, TimeUnit.MILLISECONDS));

    all.get(1).onChanges(List.of(ChangeRecord.modified("doc-1", "fresh")));
    final ChangeDelivery change = assertInstanceOf(ChangeDelivery.class,
        received.poll(1, TimeUnit.SECONDS));
    assertEquals("fresh", change.item());

    assertTrue(multiplexer.release(KEY));
    verify(port, handle);
  }

  @Test
  void whenStreamFails_givenOpenCircuit_shouldNotReopenUntilCoolDown()
      throws Exception {
    final Capture<ChangeStreamHandler> handler = newCapture();
    expect(port.open(eq(KEY), eq(DESCRIPTOR), capture(handler)))
        .andReturn(handle).once();
    handle.close();
    expectLastCall().once();
    replay(port, handle);

    final CircuitBreaker streamBreaker = breaker(1);
    final ListenerMultiplexer multiplexer = multiplexer(streamBreaker,
        RetryPolicy.of(Duration.ofMillis(10)));
    multiplexer.acquire(KEY, DESCRIPTOR);

    handler.getValue().onError(
        new ChangeStreamException("permission-denied", "rules changed"));

    assertFalse(streamBreaker.allows(KEY));
    Thread.sleep(200);
    assertEquals(0, multiplexer.activeListeners());
    assertEquals(1, multiplexer.references(KEY));

    assertTrue(multiplexer.release(KEY));
    verify(port, handle);
  }

  @Test
  void whenReacquiring_givenCircuitOpenedBeforeLastRelease_shouldNotOpen()
      throws Exception {
    expect(port.open(eq(KEY), eq(DESCRIPTOR),
        anyObject(ChangeStreamHandler.class)))
        .andThrow(new ChangeStreamException("unavailable", "backend down"))
        .once();
    replay(port, handle);

    final CircuitBreaker streamBreaker = breaker(1);
    final ListenerMultiplexer multiplexer = multiplexer(streamBreaker,
        RetryPolicy.of(Duration.ofMillis(10)));

    multiplexer.acquire(KEY, DESCRIPTOR);
    assertInstanceOf(ErrorDelivery.class, received.poll(1, TimeUnit.SECONDS));
    assertFalse(streamBreaker.allows(KEY));

    assertTrue(multiplexer.release(KEY));
    assertEquals(1, streamBreaker.openCircuits());

    multiplexer.acquire(KEY, DESCRIPTOR);
    Thread.sleep(100);

    assertEquals(1, multiplexer.references(KEY));
    assertEquals(0, multiplexer.activeListeners());
    assertFalse(streamBreaker.allows(KEY));

    assertTrue(multiplexer.release(KEY));
    verify(port, handle);
  }

  @Test
  void whenOpening_givenTransportFailure_shouldRouteErrorOffTheCallerThread()
      throws Exception {
    expect(port.open(eq(KEY), eq(DESCRIPTOR),
        anyObject(ChangeStreamHandler.class)))
        .andThrow(new ChangeStreamException("unavailable", "backend down"))
        .once();
    replay(port, handle);

    final ListenerMultiplexer multiplexer = multiplexer(breaker(5),
        RetryPolicy.of(Duration.ofMinutes(1)));
    final AtomicReference<Thread> deliveredOn = new AtomicReference<>();
    registry.register(KEY, delivery -> deliveredOn.set(Thread.currentThread()),
        SubscriptionOptions.builder().batchUpdates(false).build());

    multiplexer.acquire(KEY, DESCRIPTOR);

    assertInstanceOf(ErrorDelivery.class, received.poll(1, TimeUnit.SECONDS));
    Await.until(() -> deliveredOn.get() != null, Duration.ofSeconds(2),
        "error routed");
    assertNotSame(Thread.currentThread(), deliveredOn.get());

    assertTrue(multiplexer.release(KEY));
    verify(port, handle);
  }

  @Test
  void whenShuttingDown_shouldCloseEveryConnection() {
    final StreamHandle other = createMock(StreamHandle.class);
    expect(port.open(eq(KEY), eq(DESCRIPTOR),
        anyObject(ChangeStreamHandler.class))).andReturn(handle).once();
    expect(port.open(eq("novel:7"), eq(DESCRIPTOR),
        anyObject(ChangeStreamHandler.class))).andReturn(other).once();
    handle.close();
    expectLastCall().once();
    other.close();
    expectLastCall().once();
    replay(port, handle, other);

    final ListenerMultiplexer multiplexer = multiplexer(breaker(5),
        RetryPolicy.defaultPolicy());
    multiplexer.acquire(KEY, DESCRIPTOR);
    multiplexer.acquire("novel:7", DESCRIPTOR);
    assertEquals(2, multiplexer.activeListeners());

    multiplexer.shutdown();

    assertEquals(0, multiplexer.entryCount());
    verify(port, handle, other);
  }

  private ListenerMultiplexer multiplexer(final CircuitBreaker streamBreaker,
      final RetryPolicy retryPolicy) {
    return new ListenerMultiplexer(port, lock, router, streamBreaker,
        retryPolicy, executor, metrics);
  }

  private CircuitBreaker breaker(final int threshold) {
    return new CircuitBreaker("stream",
        CircuitBreakerPolicy.of(threshold, Duration.ofMinutes(1)), clock,
        metrics);
  }
}
