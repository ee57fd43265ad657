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

package io.github.varbits.bitstream;

import io.github.varbits.disk.ByteSink;
import io.github.varbits.exceptions.BitStreamException;
import io.github.varbits.math.UInt128;
import io.github.varbits.util.BitUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Arrays;
import java.util.Objects;

/**
 * Writes bit fields to a {@link ByteSink} through a fixed-size buffer.
 * <p>
 * Completed bytes are handed to the sink when the buffer runs out of room; a partially filled byte stays
 * buffered until more bits arrive or {@link #flush()} is called. If the sink fails, the buffer and cursor
 * are left as they were so the operation can be retried.
 * <p>
 * {@link #flush()} ends the current byte: bits written afterwards start at the next byte boundary.
 * Closing the writer flushes it and closes the sink unless it was constructed with {@code leaveOpen}.
 * Not thread-safe.
 */
public class BitStreamWriter implements BitWriter, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(BitStreamWriter.class);

    private final ByteSink sink;
    private final boolean leaveOpen;
    private final byte[] buffer;
    private int bytePos;
    private int bitPos;
    private long bytesWritten;
    private boolean closed;

    public BitStreamWriter(ByteSink sink) {
        this(sink, BitStreamConfig.defaultBufferSize(), false);
    }

    public BitStreamWriter(ByteSink sink, int capacity) {
        this(sink, capacity, false);
    }

    /**
     * @param sink where completed bytes are written
     * @param capacity buffer size in bytes, at least {@link BitStreamConfig#MIN_BUFFER_SIZE}
     * @param leaveOpen if true, {@link #close()} flushes but does not close {@code sink}
     */
    public BitStreamWriter(ByteSink sink, int capacity, boolean leaveOpen) {
        this.sink = Objects.requireNonNull(sink, "sink");
        // one spare byte for the carried partial byte, so a flushed buffer always has room for 128 bits
        this.buffer = new byte[BitStreamConfig.checkBufferSize(capacity) + 1];
        this.leaveOpen = leaveOpen;
    }

    public BitStreamWriter(OutputStream out) {
        this(ByteSink.of(out));
    }

    public BitStreamWriter(OutputStream out, int capacity, boolean leaveOpen) {
        this(ByteSink.of(out), capacity, leaveOpen);
    }

    @Override
    public void writeBits(long value, int bitCount) {
        BitUtil.checkBitCount(bitCount, BitUtil.MAX_BITS);
        ensureOpen();
        ensureRoom(bitCount);
        int left = bitCount;
        while (left > 0) {
            int n = BitPacking.chunk(bitPos, left);
            buffer[bytePos] = BitPacking.deposit(buffer[bytePos], bitPos, n, value);
            value >>>= n;
            left -= n;
            bitPos += n;
            if (bitPos == Byte.SIZE) {
                bitPos = 0;
                bytePos++;
            }
        }
    }

    @Override
    public void writeBits128(UInt128 value, int bitCount) {
        BitUtil.checkBitCount(bitCount, BitUtil.MAX_WIDE_BITS);
        ensureOpen();
        ensureRoom(bitCount);
        BitWriter.super.writeBits128(value, bitCount);
    }

    @Override
    public void alignToByte() {
        ensureOpen();
        if (bitPos != 0) {
            bitPos = 0;
            bytePos++;
        }
    }

    @Override
    public long position() {
        return (bytesWritten + bytePos) * Byte.SIZE + bitPos;
    }

    /**
     * @return number of bytes handed to the sink so far
     */
    public long bytesWritten() {
        return bytesWritten;
    }

    /**
     * Writes every buffered byte, including a partial one padded with zero bits, then flushes the sink.
     */
    public void flush() {
        ensureOpen();
        int pending = bytePos + (bitPos != 0 ? 1 : 0);
        try {
            if (pending > 0) {
                sink.write(buffer, 0, pending);
                bytesWritten += pending;
                Arrays.fill(buffer, 0, pending, (byte) 0);
                bytePos = 0;
                bitPos = 0;
                logger.debug("Flushed {} bytes, {} total", pending, bytesWritten);
            }
            sink.flush();
        } catch (IOException e) {
            throw BitStreamException.io(e);
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        BitStreamException failure = null;
        try {
            flush();
        } catch (BitStreamException e) {
            failure = e;
        }
        closed = true;
        if (!leaveOpen) {
            try {
                sink.close();
            } catch (IOException e) {
                if (failure == null) {
                    failure = BitStreamException.io(e);
                } else {
                    logger.warn("Closing sink failed after flush failure", e);
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    /**
     * Hands completed bytes to the sink if fewer than {@code bits} bits are free. Nothing is written into
     * the buffer before this succeeds, so a failing sink leaves the writer unchanged.
     */
    private void ensureRoom(int bits) {
        int free = (buffer.length - bytePos) * Byte.SIZE - bitPos;
        if (free < bits && bytePos > 0) {
            flushBuffer();
        }
    }

    /**
     * Writes the completed bytes and moves a partial byte, if any, to the front of the buffer.
     */
    private void flushBuffer() {
        int n = bytePos;
        if (n == 0) {
            return;
        }
        try {
            sink.write(buffer, 0, n);
        } catch (IOException e) {
            throw BitStreamException.io(e);
        }
        bytesWritten += n;
        byte partial = bitPos != 0 ? buffer[n] : 0;
        Arrays.fill(buffer, (byte) 0);
        buffer[0] = partial;
        bytePos = 0;
        logger.debug("Flushed {} bytes from full buffer, {} total", n, bytesWritten);
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("BitStreamWriter is closed");
        }
    }
}
