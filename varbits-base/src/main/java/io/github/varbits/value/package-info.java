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
 * Provides {@link io.github.varbits.value.BitValue}, an integer tagged with its declared bit width and
 * signedness.
 * <p>
 * A {@code BitValue} lets typed fields travel through the bit codec without the caller tracking the
 * width separately: {@code reader.readBitValue(13)} yields a value that remembers it is 13 bits wide,
 * and {@code writer.writeBitValue(value)} writes exactly those 13 bits back.
 */
package io.github.varbits.value;
