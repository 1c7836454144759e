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

import java.util.concurrent.CancellationException;

/**
 * A cancellation raised on behalf of a particular {@link CancellationSignal}.
 * <p>
 * The guard compares {@link #signal()} against the signal a caller passed in:
 * only a cancellation of the caller's own signal is treated as benign.
 * </p>
 */
public class OperationCancelledException extends CancellationException {
  private final transient CancellationSignal signal;

  public OperationCancelledException(CancellationSignal signal) {
    super("Operation was cancelled");
    this.signal = signal;
  }

  /**
   * The signal whose cancellation raised this exception.
   */
  public CancellationSignal signal() {
    return signal;
  }
}
