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

import java.nio.ByteBuffer;

/**
 * A {@link ByteSource} reading the remaining bytes of a {@code ByteBuffer}.
 * <p>
 * The source reads from a duplicate, so the position of the caller's buffer is never changed.
 */
public class ByteBufferByteSource implements ByteSource {
    private final ByteBuffer buffer;

    public ByteBufferByteSource(ByteBuffer buffer) {
        this.buffer = buffer.duplicate();
    }

    /**
     * Creates a source over the whole of {@code bytes}. The array is not copied.
     */
    public static ByteBufferByteSource wrap(byte[] bytes) {
        return new ByteBufferByteSource(ByteBuffer.wrap(bytes));
    }

    /**
     * @return the number of bytes not yet read
     */
    public int remaining() {
        return buffer.remaining();
    }

    @Override
    public int read(byte[] bytes, int offset, int length) {
        if (!buffer.hasRemaining()) {
            return -1;
        }
        int n = Math.min(length, buffer.remaining());
        buffer.get(bytes, offset, n);
        return n;
    }

    @Override
    public void close() {
        // Nothing to release
    }
}
