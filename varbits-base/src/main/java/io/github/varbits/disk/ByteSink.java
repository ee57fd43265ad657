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

package io.github.varbits.disk;

import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;

/**
 * A destination for bytes produced by {@code BitStreamWriter}.
 * <p>
 * Implementations are expected to be stateful and NOT threadsafe.
 */
public interface ByteSink extends Closeable {
    /**
     * Writes exactly {@code length} bytes from {@code buffer}.
     *
     * @param buffer the bytes to write
     * @param offset the first index of {@code buffer} to write
     * @param length the number of bytes to write
     * @throws IOException if the medium fails or cannot accept all of the bytes
     */
    void write(byte[] buffer, int offset, int length) throws IOException;

    /**
     * Writes all of {@code buffer}.
     *
     * @param buffer the bytes to write
     * @throws IOException if the medium fails
     */
    default void write(byte[] buffer) throws IOException {
        write(buffer, 0, buffer.length);
    }

    /**
     * Pushes any bytes buffered by the medium itself to their final destination.
     *
     * @throws IOException if the medium fails
     */
    void flush() throws IOException;

    /**
     * Wraps an {@code OutputStream}. Closing the returned sink closes the stream.
     *
     * @param out the stream to write to
     * @return a sink writing to {@code out}
     */
    static ByteSink of(OutputStream out) {
        return new StreamByteSink(out);
    }
}
