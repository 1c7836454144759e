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

/**
 * The states of a {@link CircuitGuard}.
 */
public enum CircuitGuardState {
  /** Calls pass through; consecutive failures are counted. */
  CLOSED,
  /** Calls are rejected until the cooldown has elapsed. */
  OPEN,
  /** A single probe call decides whether to close or re-open. */
  HALF_OPEN,
}
