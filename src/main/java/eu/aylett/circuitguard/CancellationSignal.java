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

import org.jetbrains.annotations.Contract;

import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A cooperative cancellation token.
 * <p>
 * The caller owns the signal and passes it to
 * {@link CircuitGuard#execute(java.util.function.Supplier, CancellationSignal)}
 * and friends. Operations that want to honour it check
 * {@link #throwIfCancelled()}, which raises an
 * {@link OperationCancelledException} tagged with this signal.
 * </p>
 */
public final class CancellationSignal {
  /**
   * A signal that is never cancelled.
   */
  public static final CancellationSignal NONE = new CancellationSignal(false);

  private final boolean cancellable;
  private final CopyOnWriteArrayList<Runnable> callbacks = new CopyOnWriteArrayList<>();
  private volatile boolean cancelled;

  public CancellationSignal() {
    this(true);
  }

  private CancellationSignal(boolean cancellable) {
    this.cancellable = cancellable;
  }

  /**
   * Cancel this signal, running any registered callbacks on the calling thread.
   * Cancelling twice has no further effect.
   * <p>
   * Every callback runs even if an earlier one throws. The first exception is
   * rethrown once all callbacks have run, with any later ones suppressed.
   * </p>
   *
   * @throws UnsupportedOperationException
   *           if this is {@link #NONE}
   */
  public void cancel() {
    if (!cancellable) {
      throw new UnsupportedOperationException("CancellationSignal.NONE cannot be cancelled");
    }
    synchronized (callbacks) {
      if (cancelled) {
        return;
      }
      cancelled = true;
    }
    RuntimeException failure = null;
    try {
      for (var callback : callbacks) {
        try {
          callback.run();
        } catch (RuntimeException e) {
          if (failure == null) {
            failure = e;
          } else {
            failure.addSuppressed(e);
          }
        }
      }
    } finally {
      callbacks.clear();
    }
    if (failure != null) {
      throw failure;
    }
  }

  public boolean isCancelled() {
    return cancelled;
  }

  /**
   * Whether this signal can ever be cancelled.
   */
  public boolean isCancellable() {
    return cancellable;
  }

  /**
   * @throws OperationCancelledException
   *           tagged with this signal, if it has been cancelled
   */
  public void throwIfCancelled() {
    if (cancelled) {
      throw new OperationCancelledException(this);
    }
  }

  /**
   * Run {@code callback} when this signal is cancelled, or immediately if it
   * already has been.
   *
   * @return a registration that removes the callback when closed
   */
  @Contract("_ -> new")
  public Registration onCancel(Runnable callback) {
    synchronized (callbacks) {
      if (!cancelled) {
        callbacks.add(callback);
        return new Registration(this, callback);
      }
    }
    callback.run();
    return new Registration(this, callback);
  }

  /**
   * Handle for a callback added with {@link #onCancel(Runnable)}.
   */
  public static final class Registration implements AutoCloseable {
    private final CancellationSignal signal;
    private final Runnable callback;

    private Registration(CancellationSignal signal, Runnable callback) {
      this.signal = signal;
      this.callback = callback;
    }

    @Override
    public void close() {
      signal.callbacks.remove(callback);
    }
  }
}
