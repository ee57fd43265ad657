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
 * Provides 128-bit integer arithmetic for values wider than a {@code long}.
 * <p>
 * Java has no 128-bit primitive, so wide values are modeled explicitly as a pair of 64-bit words:
 * <ul>
 *   <li>{@link io.github.varbits.math.UInt128} - unsigned, {@code value = high * 2^64 + low} with both
 *       words interpreted as unsigned.</li>
 *   <li>{@link io.github.varbits.math.Int128} - signed two's complement, where {@code high} holds the
 *       signed high word and {@code low} the unsigned low word.</li>
 * </ul>
 * Both types are immutable and implement addition, subtraction, shifts, bitwise operations and
 * ordering directly on the word pair. Arithmetic wraps modulo 2^128, like Java's own integer types.
 * Conversions to and from {@link java.math.BigInteger} are provided for interoperability and
 * display; no arithmetic goes through {@code BigInteger}.
 *
 * <pre>{@code
 * UInt128 a = UInt128.of(0x1L, 0xFFFF_FFFF_FFFF_FFFFL);
 * UInt128 b = a.add(UInt128.ONE);          // high = 2, low = 0
 * UInt128 c = b.shiftRight(65);            // 1
 * }</pre>
 */
package io.github.varbits.math;
