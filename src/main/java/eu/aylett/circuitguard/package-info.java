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

/**
 * There's little point in sending requests to a service that we can be
 * reasonably sure will fail, and every point in giving it room to recover.
 * <p>
 * A {@link eu.aylett.circuitguard.CircuitGuard} counts consecutive failures of
 * the calls it protects. Once a threshold is reached it stops calling the
 * service for a cooldown period, failing fast with
 * {@link eu.aylett.circuitguard.CircuitGuardOpenException} instead. After the
 * cooldown, the next call is let through as a probe: if it succeeds the guard
 * closes again, if it fails the guard re-opens.
 * </p>
 * <p>
 * One instance of CircuitGuard should be used for each distinct fault zone
 * (normally each service) you call. Calls through the same instance are
 * serialized: only one protected call runs at a time.
 * </p>
 */
@NullMarked
package eu.aylett.circuitguard;

import org.jspecify.annotations.NullMarked;
