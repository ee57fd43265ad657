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

import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * A {@link ByteSink} backed by a {@code ByteBuffer}, for building bit-packed records in memory
 * before they are handed to another layer.
 * <p>
 * The buffer has a fixed capacity; a write that does not fit fails with an {@code IOException} and
 * writes nothing. Not thread-safe. Each thread should use its own instance.
 */
public class ByteBufferByteSink implements ByteSink {
    private final ByteBuffer buffer;
    private final int initialPosition;

    /**
     * Creates a sink that writes to the given buffer starting at its current position.
     * Each write advances the buffer's position.
     */
    public ByteBufferByteSink(ByteBuffer buffer) {
        this.buffer = buffer;
        this.initialPosition = buffer.position();
    }

    /**
     * Creates a sink with a new heap ByteBuffer of the given capacity.
     */
    public static ByteBufferByteSink allocate(int capacity) {
        return new ByteBufferByteSink(ByteBuffer.allocate(capacity));
    }

    /**
     * Creates a sink with a new direct ByteBuffer of the given capacity.
     */
    public static ByteBufferByteSink allocateDirect(int capacity) {
        return new ByteBufferByteSink(ByteBuffer.allocateDirect(capacity));
    }

    /**
     * Returns the backing buffer, positioned just past the last byte written.
     */
    public ByteBuffer getBuffer() {
        return buffer;
    }

    /**
     * Returns a read-only view of the bytes written since construction or the last {@link #reset()}.
     */
    public ByteBuffer getWrittenData() {
        ByteBuffer view = buffer.duplicate();
        view.limit(buffer.position());
        view.position(initialPosition);
        return view.slice().asReadOnlyBuffer();
    }

    /**
     * Returns a copy of the written data.
     */
    public byte[] toByteArray() {
        ByteBuffer written = getWrittenData();
        byte[] bytes = new byte[written.remaining()];
        written.get(bytes);
        return bytes;
    }

    /**
     * Discards everything written so far; the next write lands at the starting position again.
     */
    public void reset() {
        buffer.position(initialPosition);
    }

    /**
     * @return the number of bytes written since creation or the last {@link #reset()}
     */
    public long position() {
        return buffer.position() - initialPosition;
    }

    @Override
    public void write(byte[] bytes, int offset, int length) throws IOException {
        if (length > buffer.remaining()) {
            throw new IOException(String.format("Buffer full: cannot write %d bytes, %d remaining",
                                                length, buffer.remaining()));
        }
        buffer.put(bytes, offset, length);
    }

    @Override
    public void flush() {
        // nothing buffered outside the ByteBuffer itself
    }

    @Override
    public void close() {
        // nothing to release
    }
}
