/*
 * Copyright DataStax, Inc.
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
 * Provides the exception type raised by the bit codec.
 * <p>
 * Every failure of a bit-level operation surfaces as an unchecked
 * {@link io.github.varbits.exceptions.BitStreamException} carrying one of a flat set of
 * {@link io.github.varbits.exceptions.BitStreamException.ErrorType error types}:
 * <ul>
 *   <li>{@code INVALID_BIT_COUNT} - a requested width outside the range of the operation. This is
 *       always a caller bug and is never retried.</li>
 *   <li>{@code END_OF_STREAM} - fewer bits remain than a read asked for. Streaming readers only raise
 *       it once the underlying source has reported end-of-data.</li>
 *   <li>{@code IO} - the underlying byte medium failed. The causing {@link java.io.IOException} is
 *       preserved as the cause, and the component is left in a state from which the operation may
 *       be retried.</li>
 *   <li>{@code INVALID_CONVERSION} - a {@link io.github.varbits.value.BitValue} conversion that cannot
 *       be represented, such as a negative 128-bit value requested as an unsigned 64-bit one.</li>
 * </ul>
 *
 * <h2>Exception Handling Example</h2>
 * <pre>{@code
 * try {
 *     long header = reader.readBits(12);
 * } catch (BitStreamException e) {
 *     if (e.getErrorType() == BitStreamException.ErrorType.END_OF_STREAM) {
 *         // graceful termination
 *     } else {
 *         throw e;
 *     }
 * }
 * }</pre>
 */
package io.github.varbits.exceptions;
