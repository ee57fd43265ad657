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
 * Bit-granular readers and writers.
 * <p>
 * {@link io.github.varbits.bitstream.BitStream} is an in-memory, seekable container;
 * {@link io.github.varbits.bitstream.BitStreamReader} and {@link io.github.varbits.bitstream.BitStreamWriter}
 * stream bits through a fixed-size buffer over a {@link io.github.varbits.disk.ByteSource} or
 * {@link io.github.varbits.disk.ByteSink}. All of them pack bits least-significant-bit first within each byte,
 * bytes in ascending order, and produce identical bytes for the same sequence of calls.
 */
package io.github.varbits.bitstream;
