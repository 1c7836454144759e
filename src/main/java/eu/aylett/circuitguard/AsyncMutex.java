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

import java.util.ArrayDeque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

import static eu.aylett.circuitguard.SneakyThrows.sneakyThrow;

/**
 * A binary lock that can be waited for either by blocking or by composing on a
 * future.
 * <p>
 * Ownership isn't tied to a thread: whoever was granted the lock releases it,
 * possibly from a different thread. Waiters are granted the lock in arrival
 * order. A grant is handed over on {@code handoff}, so a long queue of waiters
 * does not unwind on the releasing thread's stack.
 * </p>
 */
final class AsyncMutex {
  private final Executor handoff;
  private final ArrayDeque<CompletableFuture<Void>> waiters = new ArrayDeque<>();
  private boolean held;

  AsyncMutex(Executor handoff) {
    this.handoff = handoff;
  }

  /**
   * Ask for the lock.
   * <p>
   * The returned future completes when the lock is granted, or fails with an
   * {@link OperationCancelledException} if {@code signal} is cancelled first.
   * Only a successfully completed future owns the lock.
   * </p>
   */
  CompletableFuture<Void> acquire(CancellationSignal signal) {
    if (signal.isCancelled()) {
      return CompletableFuture.failedFuture(new OperationCancelledException(signal));
    }
    var waiter = new CompletableFuture<Void>();
    synchronized (waiters) {
      if (!held) {
        held = true;
        waiter.complete(null);
        return waiter;
      }
      waiters.add(waiter);
    }
    if (signal.isCancellable()) {
      var registration = signal
          .onCancel(() -> waiter.completeExceptionally(new OperationCancelledException(signal)));
      waiter.whenComplete((ignored, error) -> registration.close());
    }
    return waiter;
  }

  /**
   * Wait for the lock, blocking the calling thread.
   *
   * @throws InterruptedException
   *           if the thread was interrupted while waiting; the lock is not held
   *           and the thread's interrupt flag is set again
   * @throws OperationCancelledException
   *           if {@code signal} was cancelled while waiting; the lock is not held
   */
  void acquireBlocking(CancellationSignal signal) throws InterruptedException {
    var waiter = acquire(signal);
    try {
      waiter.get();
    } catch (InterruptedException e) {
      abandon(waiter);
      Thread.currentThread().interrupt();
      throw e;
    } catch (ExecutionException e) {
      throw sneakyThrow(e.getCause());
    }
  }

  /**
   * Give the lock to the next live waiter, or mark it free.
   */
  void release() {
    CompletableFuture<Void> next;
    synchronized (waiters) {
      next = waiters.poll();
      if (next == null) {
        held = false;
        return;
      }
    }
    var granted = next;
    handoff.execute(() -> {
      // A waiter that was cancelled in the meantime can't take the lock.
      if (!granted.complete(null)) {
        release();
      }
    });
  }

  private void abandon(CompletableFuture<Void> waiter) {
    if (!waiter.completeExceptionally(new InterruptedException()) && !waiter.isCompletedExceptionally()) {
      release();
    }
  }
}
