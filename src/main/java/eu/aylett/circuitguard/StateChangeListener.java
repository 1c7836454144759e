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
 * Observer of {@link CircuitGuard} state changes.
 * <p>
 * Called once per actual change, never for a no-op transition. The new state
 * is read from the guard, and may already be stale by the time the listener
 * runs. Listeners run on the guard's notification executor, not while the guard
 * holds its lock. Anything a listener throws is logged and otherwise ignored.
 * </p>
 */
@FunctionalInterface
public interface StateChangeListener {
  void onStateChanged(CircuitGuard guard);
}
