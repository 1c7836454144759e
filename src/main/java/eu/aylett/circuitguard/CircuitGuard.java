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

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.InstantSource;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Supplier;

import static eu.aylett.circuitguard.SneakyThrows.sneakyThrow;

/**
 * A circuit breaker that stops calling a failing service for a while, then lets
 * a single probe call through to see whether it has recovered.
 * <p>
 * Every call through a guard holds the guard's lock from the moment it looks
 * at the state until the protected operation has finished and its outcome has
 * been recorded. Calls through one guard therefore never overlap, and there is
 * never more than one half-open probe in flight.
 * </p>
 */
public class CircuitGuard {
  private final int threshold;
  private final Duration timeout;
  private final Logger logger;
  private final InstantSource clock;
  private final Executor notificationExecutor;
  private final AsyncMutex lock;
  private final CopyOnWriteArrayList<StateChangeListener> listeners = new CopyOnWriteArrayList<>();
  private final AtomicInteger failures = new AtomicInteger(0);

  private volatile CircuitGuardState state = CircuitGuardState.CLOSED;
  // Only touched while holding the lock.
  private @Nullable Instant lastFailureTime;

  /**
   * A fully configurable guard.
   * <p>
   * You probably don't need to call this constructor directly.
   * </p>
   *
   * @param threshold
   *          the number of consecutive failures that opens the guard; at least 1
   * @param timeout
   *          how long the guard stays open before letting a probe through
   * @param logger
   *          where to log failures and state changes
   * @param clock
   *          the time source used to measure the cooldown (mainly for testing)
   * @param notificationExecutor
   *          runs state change listeners (mainly for testing)
   * @param handoffExecutor
   *          hands the lock over to the next waiting call when a call finishes;
   *          a waiting asynchronous call continues on this executor
   */
  public CircuitGuard(int threshold, Duration timeout, Logger logger, InstantSource clock,
      Executor notificationExecutor, Executor handoffExecutor) {
    Objects.requireNonNull(timeout, "timeout");
    Objects.requireNonNull(logger, "logger");
    Objects.requireNonNull(clock, "clock");
    Objects.requireNonNull(notificationExecutor, "notificationExecutor");
    Objects.requireNonNull(handoffExecutor, "handoffExecutor");
    if (threshold < 1) {
      throw new IllegalArgumentException("threshold must be at least 1, was " + threshold);
    }
    if (timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be positive, was " + timeout);
    }
    this.threshold = threshold;
    this.timeout = timeout;
    this.logger = logger;
    this.clock = clock;
    this.notificationExecutor = notificationExecutor;
    this.lock = new AsyncMutex(handoffExecutor);
  }

  /**
   * Guard handing its lock over on the common fork-join pool.
   */
  public CircuitGuard(int threshold, Duration timeout, Logger logger, InstantSource clock,
      Executor notificationExecutor) {
    this(threshold, timeout, logger, clock, notificationExecutor, ForkJoinPool.commonPool());
  }

  /**
   * Guard logging to the given logger, using the system clock.
   */
  public CircuitGuard(int threshold, Duration timeout, Logger logger) {
    this(threshold, timeout, logger, Clock.systemUTC(), ForkJoinPool.commonPool());
  }

  /**
   * Guard logging to its own class logger, using the system clock.
   */
  public CircuitGuard(int threshold, Duration timeout) {
    this(threshold, timeout, LoggerFactory.getLogger(CircuitGuard.class));
  }

  /**
   * Call the callable unless the guard is open.
   *
   * @return the callable's result, or {@code null} if it was cancelled through
   *         {@code signal}
   * @throws CircuitGuardOpenException
   *           if the guard is open; the callable is not called
   * @throws OperationCancelledException
   *           if {@code signal} was cancelled while waiting for the guard
   * @throws InterruptedException
   *           if interrupted while waiting for the guard
   * @throws Exception
   *           anything thrown by the callable, unchanged
   */
  public <T> @Nullable T checkedExecute(Callable<T> callable, CancellationSignal signal) throws Exception {
    Objects.requireNonNull(callable, "callable");
    Objects.requireNonNull(signal, "signal");
    lock.acquireBlocking(signal);
    try {
      var probe = admit();
      T result;
      try {
        signal.throwIfCancelled();
        result = callable.call();
      } catch (Exception e) {
        return settleFailure(e, probe, signal);
      }
      recordSuccess();
      return result;
    } finally {
      lock.release();
    }
  }

  /**
   * Call the supplier unless the guard is open.
   *
   * @return the supplier's result, or {@code null} if it was cancelled through
   *         {@code signal}
   * @throws CircuitGuardOpenException
   *           if the guard is open, or any exception thrown by the supplier.
   */
  public <T> @Nullable T execute(Supplier<T> supplier, CancellationSignal signal) {
    try {
      return checkedExecute(supplier::get, signal);
    } catch (Exception e) {
      throw sneakyThrow(e);
    }
  }

  /**
   * Call the runnable unless the guard is open.
   *
   * @throws CircuitGuardOpenException
   *           if the guard is open, or any exception thrown by the runnable.
   */
  public void execute(Runnable runnable, CancellationSignal signal) {
    try {
      checkedExecute(() -> {
        runnable.run();
        return null;
      }, signal);
    } catch (Exception e) {
      throw sneakyThrow(e);
    }
  }

  /**
   * Call the supplier unless the guard is open, without a way to cancel it.
   */
  public <T> @Nullable T execute(Supplier<T> supplier) {
    return execute(supplier, CancellationSignal.NONE);
  }

  /**
   * Call the runnable unless the guard is open, without a way to cancel it.
   */
  public void execute(Runnable runnable) {
    execute(runnable, CancellationSignal.NONE);
  }

  /**
   * Start the asynchronous operation unless the guard is open.
   * <p>
   * No thread is blocked while waiting for the guard. The guard stays locked
   * until the stage returned by {@code operation} completes.
   * </p>
   *
   * @return a future of the operation's result, or of {@code null} if it was
   *         cancelled through {@code signal}. It fails with
   *         {@link CircuitGuardOpenException} if the guard is open, or with
   *         whatever the operation failed with.
   */
  public <T> CompletableFuture<@Nullable T> executeAsync(Supplier<? extends CompletionStage<T>> operation,
      CancellationSignal signal) {
    Objects.requireNonNull(operation, "operation");
    Objects.requireNonNull(signal, "signal");
    return lock.acquire(signal).thenCompose(granted -> {
      CompletableFuture<@Nullable T> outcome;
      try {
        outcome = attemptAsync(operation, signal);
      } catch (RuntimeException e) {
        outcome = CompletableFuture.failedFuture(e);
      }
      return outcome.whenComplete((result, error) -> lock.release());
    });
  }

  /**
   * Wrap a Supplier so that when it's called, it goes through the guard.
   */
  public <T> Supplier<@Nullable T> wrap(Supplier<T> supplier) {
    return () -> execute(supplier);
  }

  /**
   * Wrap a Runnable so that when it's called, it goes through the guard.
   */
  public Runnable wrap(Runnable runnable) {
    return () -> execute(runnable);
  }

  /**
   * Wrap a Function so that when it's called, it goes through the guard.
   */
  public <T, R> Function<T, @Nullable R> wrap(Function<T, R> function) {
    return (T t) -> execute(() -> function.apply(t));
  }

  /**
   * The current state. Doesn't wait for a call in progress, so it may be about
   * to change.
   */
  public CircuitGuardState getState() {
    return state;
  }

  /**
   * The number of consecutive failures recorded since the guard last closed.
   */
  public int getFailureCount() {
    return failures.get();
  }

  public int getThreshold() {
    return threshold;
  }

  public Duration getTimeout() {
    return timeout;
  }

  public void addStateChangeListener(StateChangeListener listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  public void removeStateChangeListener(StateChangeListener listener) {
    listeners.remove(listener);
  }

  private <T> CompletableFuture<@Nullable T> attemptAsync(Supplier<? extends CompletionStage<T>> operation,
      CancellationSignal signal) {
    var probe = admit();
    CompletionStage<T> stage;
    try {
      signal.throwIfCancelled();
      stage = Objects.requireNonNull(operation.get(), "operation returned null");
    } catch (Exception e) {
      stage = CompletableFuture.failedFuture(e);
    }
    return stage.<@Nullable T>handle((result, error) -> {
      if (error != null) {
        return settleFailure(unwrap(error), probe, signal);
      }
      recordSuccess();
      return result;
    }).toCompletableFuture();
  }

  /**
   * Decide whether a call may go ahead. Must hold the lock.
   *
   * @return whether the call is a half-open probe
   * @throws CircuitGuardOpenException
   *           if the guard is open and the cooldown hasn't elapsed
   */
  private boolean admit() {
    switch (state) {
      case CLOSED -> {
        return false;
      }
      case OPEN -> {
        var openedAt = lastFailureTime;
        if (openedAt == null) {
          throw new IllegalStateException("Circuit guard is open without a recorded failure");
        }
        var elapsed = Duration.between(openedAt, clock.instant());
        if (elapsed.compareTo(timeout) < 0) {
          logger.debug("Rejecting call, circuit guard is open");
          throw new CircuitGuardOpenException(failures.get(), timeout.minus(elapsed));
        }
        // Not announced: the probe's outcome moves the guard on straight away.
        state = CircuitGuardState.HALF_OPEN;
        return true;
      }
      case HALF_OPEN -> {
        return true;
      }
      default -> throw new IllegalStateException("Invalid state in circuit guard: " + state);
    }
  }

  /**
   * Classify an exception thrown by a protected operation. Must hold the lock.
   *
   * @return {@code null} if the caller's own signal cancelled the operation
   */
  private <T> @Nullable T settleFailure(Throwable error, boolean probe, CancellationSignal signal) {
    if (error instanceof OperationCancelledException cancelled && cancelled.signal() == signal) {
      logger.info("Operation was cancelled");
      return null;
    }
    if (error instanceof CancellationException || error instanceof InterruptedException
        || !(error instanceof Exception)) {
      throw sneakyThrow(error);
    }
    recordFailure(error, probe);
    throw sneakyThrow(error);
  }

  private void recordSuccess() {
    failures.set(0);
    transitionTo(CircuitGuardState.CLOSED);
  }

  private void recordFailure(Throwable error, boolean probe) {
    if (probe) {
      logger.error("Error during probe in half-open state", error);
    } else {
      logger.error("Error during operation in closed state", error);
    }
    var count = failures.incrementAndGet();
    lastFailureTime = clock.instant();
    // A failed probe re-opens whatever the threshold.
    if (probe || count >= threshold) {
      transitionTo(CircuitGuardState.OPEN);
    }
  }

  private void transitionTo(CircuitGuardState next) {
    if (state == next) {
      return;
    }
    state = next;
    logger.info("Circuit guard state changed to {}", next);
    for (var listener : listeners) {
      try {
        notificationExecutor.execute(() -> dispatch(listener));
      } catch (RejectedExecutionException e) {
        logger.warn("Could not dispatch state change to {}", listener, e);
      }
    }
  }

  private void dispatch(StateChangeListener listener) {
    try {
      listener.onStateChanged(this);
    } catch (RuntimeException e) {
      logger.warn("State change listener {} failed", listener, e);
    }
  }

  private static Throwable unwrap(Throwable error) {
    var cause = error.getCause();
    if ((error instanceof CompletionException || error instanceof ExecutionException) && cause != null) {
      return cause;
    }
    return error;
  }
}
