/*
 * Copyright 2025 Andrew Aylett
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package eu.aylett.circuitguard;

import com.google.common.util.concurrent.MoreExecutors;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class CancellationTest {
  private final Logger logger = mock(Logger.class);

  private CircuitGuard guard(int threshold) {
    var clock = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneId.of("UTC"));
    return new CircuitGuard(threshold, Duration.ofSeconds(10), logger, clock, MoreExecutors.directExecutor());
  }

  @Test
  void testOwnCancellationIsBenign() {
    var guard = guard(1);
    var signal = new CancellationSignal();
    guard.execute(() -> {
      signal.cancel();
      signal.throwIfCancelled();
    }, signal);
    assertEquals(CircuitGuardState.CLOSED, guard.getState());
    assertEquals(0, guard.getFailureCount());
    verify(logger).info("Operation was cancelled");
  }

  @Test
  void testOwnCancellationYieldsNoValue() {
    var guard = guard(1);
    var signal = new CancellationSignal();
    String result = guard.execute(() -> {
      signal.cancel();
      signal.throwIfCancelled();
      return "unreachable";
    }, signal);
    assertNull(result);
    assertEquals(CircuitGuardState.CLOSED, guard.getState());
  }

  @Test
  void testCancelledBeforeCallIsNotInvoked() {
    var guard = guard(1);
    var signal = new CancellationSignal();
    signal.cancel();
    var calls = new AtomicInteger();
    var e = assertThrows(OperationCancelledException.class, () -> guard.execute(calls::incrementAndGet, signal));
    assertSame(signal, e.signal());
    assertEquals(0, calls.get());
    assertEquals(0, guard.getFailureCount());
  }

  @Test
  void testForeignCancellationPropagatesUncounted() {
    var guard = guard(1);
    var mine = new CancellationSignal();
    var other = new CancellationSignal();
    other.cancel();
    var thrown = assertThrows(OperationCancelledException.class,
        () -> guard.execute(other::throwIfCancelled, mine));
    assertSame(other, thrown.signal());
    assertEquals(CircuitGuardState.CLOSED, guard.getState());
    assertEquals(0, guard.getFailureCount());
  }

  @Test
  void testPlainCancellationPropagatesUncounted() {
    var guard = guard(1);
    var cancellation = new CancellationException("from deeper down");
    var thrown = assertThrows(CancellationException.class, () -> guard.execute(() -> {
      throw cancellation;
    }));
    assertSame(cancellation, thrown);
    assertEquals(CircuitGuardState.CLOSED, guard.getState());
    assertEquals(0, guard.getFailureCount());
  }

  @Test
  void testInterruptedOperationPropagatesUncounted() {
    var guard = guard(1);
    var interrupted = new InterruptedException("stop");
    var thrown = assertThrows(InterruptedException.class, () -> guard.checkedExecute(() -> {
      throw interrupted;
    }, CancellationSignal.NONE));
    assertSame(interrupted, thrown);
    assertEquals(0, guard.getFailureCount());
  }

  @Test
  void testCancelledProbeLeavesGuardHalfOpen() {
    var now = new Instant[]{Instant.parse("2024-01-01T00:00:00Z")};
    var guard = new CircuitGuard(1, Duration.ofSeconds(1), logger, () -> now[0], MoreExecutors.directExecutor());
    assertThrows(IllegalStateException.class, () -> guard.execute(() -> {
      throw new IllegalStateException("fail");
    }));
    now[0] = now[0].plusSeconds(1);

    var signal = new CancellationSignal();
    guard.execute(() -> {
      signal.cancel();
      signal.throwIfCancelled();
    }, signal);
    assertEquals(CircuitGuardState.HALF_OPEN, guard.getState());

    assertEquals("ok", guard.execute(() -> "ok"));
    assertEquals(CircuitGuardState.CLOSED, guard.getState());
  }

  @Test
  void testCancelWhileWaitingForGuard() throws Exception {
    var guard = guard(1);
    var holding = new CountDownLatch(1);
    var finish = new CountDownLatch(1);
    var executor = Executors.newFixedThreadPool(2);
    try {
      Future<?> holder = executor.submit(() -> guard.execute(() -> {
        holding.countDown();
        awaitQuietly(finish);
      }));
      assertTrue(holding.await(5, TimeUnit.SECONDS));

      var signal = new CancellationSignal();
      var calls = new AtomicInteger();
      Future<?> waiter = executor.submit(() -> guard.execute(calls::incrementAndGet, signal));
      // Give the waiter a chance to queue up; cancelling first is fine too.
      Thread.sleep(50);
      signal.cancel();

      var e = assertThrows(ExecutionException.class, () -> waiter.get(5, TimeUnit.SECONDS));
      assertThat(e.getCause(), instanceOf(OperationCancelledException.class));
      assertEquals(0, calls.get());

      finish.countDown();
      holder.get(5, TimeUnit.SECONDS);
      assertEquals("free", guard.execute(() -> "free"));
    } finally {
      finish.countDown();
      executor.shutdownNow();
    }
  }

  @Test
  void testInterruptWhileWaitingForGuard() throws Exception {
    var guard = guard(1);
    var holding = new CountDownLatch(1);
    var finish = new CountDownLatch(1);
    var executor = Executors.newFixedThreadPool(2);
    try {
      Future<?> holder = executor.submit(() -> guard.execute(() -> {
        holding.countDown();
        awaitQuietly(finish);
      }));
      assertTrue(holding.await(5, TimeUnit.SECONDS));

      var thrown = new AtomicReference<Throwable>();
      var flagSet = new AtomicBoolean();
      var calls = new AtomicInteger();
      var waiter = new Thread(() -> {
        try {
          guard.execute(calls::incrementAndGet);
        } catch (Exception e) {
          thrown.set(e);
          flagSet.set(Thread.currentThread().isInterrupted());
        }
      });
      waiter.start();
      Thread.sleep(50);
      waiter.interrupt();
      waiter.join(5000);

      assertThat(thrown.get(), instanceOf(InterruptedException.class));
      assertTrue(flagSet.get());
      assertEquals(0, calls.get());

      finish.countDown();
      holder.get(5, TimeUnit.SECONDS);
      assertEquals("free", guard.execute(() -> "free"));
    } finally {
      finish.countDown();
      executor.shutdownNow();
    }
  }

  private static void awaitQuietly(CountDownLatch latch) {
    try {
      if (!latch.await(5, TimeUnit.SECONDS)) {
        throw new IllegalStateException("timed out");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException(e);
    }
  }
}
