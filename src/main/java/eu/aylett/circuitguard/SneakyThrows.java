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

/**
 * Rethrows checked exceptions without declaring them.
 */
final class SneakyThrows {
  private SneakyThrows() {
  }

  /**
   * Throws {@code throwable} as-is, whatever its type.
   * <p>
   * Declared to return an exception so callers can write
   * {@code throw sneakyThrow(e);} and keep the compiler's flow analysis happy.
   * </p>
   */
  @Contract("_ -> fail")
  static RuntimeException sneakyThrow(Throwable throwable) {
    throw SneakyThrows.<RuntimeException>rethrow(throwable);
  }

  @SuppressWarnings("unchecked")
  private static <E extends Throwable> E rethrow(Throwable throwable) throws E {
    throw (E) throwable;
  }
}
