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

import java.time.Duration;

/**
 * Exception thrown when a call is rejected because the guard is open.
 * <p>
 * The protected operation was not invoked. Callers can catch this to fail
 * fast (a "service unavailable" response, a cached value) without inspecting
 * messages.
 * </p>
 */
public class CircuitGuardOpenException extends RuntimeException {
  /**
   * The number of failures recorded when the guard opened.
   */
  public final int failures;
  /**
   * How much of the cooldown was left when the call was rejected.
   */
  public final Duration remaining;

  /**
   * Constructs a new CircuitGuardOpenException with details about the guard.
   *
   * @param failures
   *          the failure count at the time of rejection
   * @param remaining
   *          the time left before the guard will let a probe through
   */
  public CircuitGuardOpenException(int failures, Duration remaining) {
    super("Service is unavailable. Circuit guard is in open state (" + failures + " failures, probe allowed in "
        + remaining + ")");
    this.failures = failures;
    this.remaining = remaining;
  }
}
