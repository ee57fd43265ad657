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
 * Low-level helpers shared by the bit codec.
 * <p>
 * {@link io.github.varbits.util.BitUtil} holds the width limits of the codec, mask construction
 * and bit-count validation. All methods are static and allocation free so that they can sit on the
 * per-field hot path of readers and writers.
 */
package io.github.varbits.util;
