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
 * Provides the byte-level I/O seam between the bit codec and the medium it reads from or writes to.
 * <p>
 * The streaming bit reader and writer never touch files, sockets or buffers directly. They only need
 * two capabilities, expressed as interfaces in this package.
 *
 * <h2>Core Abstractions</h2>
 * <ul>
 *   <li>{@link io.github.varbits.disk.ByteSource} - "read up to N bytes", returning how many were
 *       read, with {@code 0} or {@code -1} meaning end-of-data.</li>
 *   <li>{@link io.github.varbits.disk.ByteSink} - "write exactly N bytes" and "flush".</li>
 * </ul>
 * Both report failures as {@link java.io.IOException}, which the codec wraps into a
 * {@code BitStreamException} of type {@code IO}.
 *
 * <h2>Implementations</h2>
 * <ul>
 *   <li>{@link io.github.varbits.disk.StreamByteSource} / {@link io.github.varbits.disk.StreamByteSink} -
 *       adapters over {@code InputStream} and {@code OutputStream}, also reachable through
 *       {@code ByteSource.of} and {@code ByteSink.of}.</li>
 *   <li>{@link io.github.varbits.disk.ByteBufferByteSource} / {@link io.github.varbits.disk.ByteBufferByteSink} -
 *       in-memory media backed by a heap or direct {@code ByteBuffer}.</li>
 *   <li>{@link io.github.varbits.disk.FileByteSource} / {@link io.github.varbits.disk.FileByteSink} -
 *       files accessed through a {@code FileChannel}.</li>
 * </ul>
 *
 * <h2>Usage Pattern</h2>
 * <pre>{@code
 * try (BitStreamWriter writer = new BitStreamWriter(FileByteSink.create(path))) {
 *     writer.writeBits(5, 3);
 *     writer.writeBits(0x1FF, 9);
 * }
 * try (BitStreamReader reader = new BitStreamReader(FileByteSource.open(path))) {
 *     long a = reader.readBits(3);
 *     long b = reader.readBits(9);
 * }
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * None of the implementations are thread-safe. Use one instance per task or connection.
 */
package io.github.varbits.disk;
