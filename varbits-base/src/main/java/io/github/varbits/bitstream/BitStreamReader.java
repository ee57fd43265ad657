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

import io.github.varbits.disk.ByteSource;
import io.github.varbits.exceptions.BitStreamException;
import io.github.varbits.math.UInt128;
import io.github.varbits.util.BitUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * Reads bit fields from a {@link ByteSource} through a fixed-size buffer.
 * <p>
 * When the buffered bits run short, unread bytes are moved to the front of the buffer and the rest is
 * refilled from the source, so fields may straddle refills and short reads from the source are
 * harmless. {@code END_OF_STREAM} is reported only after the source itself has reported end of data.
 * <p>
 * Closing the reader closes the source unless it was constructed with {@code leaveOpen}.
 * Not thread-safe.
 */
public class BitStreamReader implements BitReader, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(BitStreamReader.class);

    private final ByteSource source;
    private final boolean leaveOpen;
    private final byte[] buffer;
    // valid bytes in buffer
    private int bufferSize;
    private int bytePos;
    private int bitPos;
    private long bytesFetched;
    private boolean atEndOfSource;
    private boolean closed;

    public BitStreamReader(ByteSource source) {
        this(source, BitStreamConfig.defaultBufferSize(), false);
    }

    public BitStreamReader(ByteSource source, int capacity) {
        this(source, capacity, false);
    }

    /**
     * @param source where bytes are read from
     * @param capacity buffer size in bytes, at least {@link BitStreamConfig#MIN_BUFFER_SIZE}
     * @param leaveOpen if true, {@link #close()} leaves {@code source} open
     */
    public BitStreamReader(ByteSource source, int capacity, boolean leaveOpen) {
        this.source = Objects.requireNonNull(source, "source");
        // one spare byte holds the partially read byte, so a compacted buffer always has room for 128 bits
        this.buffer = new byte[BitStreamConfig.checkBufferSize(capacity) + 1];
        this.leaveOpen = leaveOpen;
    }

    public BitStreamReader(InputStream in) {
        this(ByteSource.of(in));
    }

    public BitStreamReader(InputStream in, int capacity, boolean leaveOpen) {
        this(ByteSource.of(in), capacity, leaveOpen);
    }

    @Override
    public long readBits(int bitCount) {
        BitUtil.checkBitCount(bitCount, BitUtil.MAX_BITS);
        ensureOpen();
        if (!ensureAvailable(bitCount)) {
            throw BitStreamException.endOfStream();
        }
        long result = 0;
        int shift = 0;
        int left = bitCount;
        while (left > 0) {
            int n = BitPacking.chunk(bitPos, left);
            result |= BitPacking.extract(buffer[bytePos], bitPos, n) << shift;
            shift += n;
            left -= n;
            bitPos += n;
            if (bitPos == Byte.SIZE) {
                bitPos = 0;
                bytePos++;
            }
        }
        return result;
    }

    @Override
    public UInt128 readBits128(int bitCount) {
        BitUtil.checkBitCount(bitCount, BitUtil.MAX_WIDE_BITS);
        ensureOpen();
        reserve(bitCount);
        return BitReader.super.readBits128(bitCount);
    }

    /**
     * Fails without consuming anything if fewer than {@code count} bytes remain, as long as {@code count}
     * fits in the buffer. Larger requests are checked up to the buffer size only.
     */
    @Override
    public byte[] readBytes(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be non-negative: " + count);
        }
        ensureOpen();
        reserve((long) count * Byte.SIZE);
        return BitReader.super.readBytes(count);
    }

    /**
     * Fails without consuming anything if fewer than {@code bitCount} bits remain, as long as
     * {@code bitCount} fits in the buffer. Larger skips are checked up to the buffer size only.
     */
    @Override
    public void skipBits(long bitCount) {
        if (bitCount < 0) {
            throw new IllegalArgumentException("bitCount must be non-negative: " + bitCount);
        }
        ensureOpen();
        reserve(bitCount);
        BitReader.super.skipBits(bitCount);
    }

    @Override
    public void alignToByte() {
        ensureOpen();
        if (bitPos != 0) {
            bitPos = 0;
            bytePos++;
        }
    }

    /**
     * Returns true once the source is exhausted and every buffered bit has been read. When the buffer is
     * drained but the source has not yet reported end of data, this reads from the source to find out.
     */
    @Override
    public boolean isAtEnd() {
        ensureOpen();
        return !ensureAvailable(1);
    }

    @Override
    public long position() {
        return (bytesFetched - bufferSize + bytePos) * Byte.SIZE + bitPos;
    }

    /**
     * @return number of bytes read from the source so far, including bytes still buffered
     */
    public long bytesConsumed() {
        return bytesFetched;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (leaveOpen) {
            return;
        }
        try {
            source.close();
        } catch (IOException e) {
            throw BitStreamException.io(e);
        }
    }

    private int availableBits() {
        return (bufferSize - bytePos) * Byte.SIZE - bitPos;
    }

    /**
     * Buffers the next {@code bits} bits, or as many as the buffer can hold.
     *
     * @throws BitStreamException {@code END_OF_STREAM} if the source ends first
     */
    private void reserve(long bits) {
        // a compacted buffer holds at least buffer.length * 8 - 7 bits
        int wanted = (int) Math.min(bits, (long) buffer.length * Byte.SIZE - (Byte.SIZE - 1));
        if (!ensureAvailable(wanted)) {
            throw BitStreamException.endOfStream();
        }
    }

    private boolean ensureAvailable(int bits) {
        while (availableBits() < bits) {
            if (!fillBuffer()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Moves unread bytes to the front of the buffer and reads from the source into the free space.
     *
     * @return false if nothing was added because the source is exhausted
     */
    private boolean fillBuffer() {
        if (atEndOfSource) {
            return false;
        }
        if (bytePos > 0) {
            int unread = bufferSize - bytePos;
            System.arraycopy(buffer, bytePos, buffer, 0, unread);
            bufferSize = unread;
            bytePos = 0;
        }
        if (bufferSize == buffer.length) {
            return false;
        }

        int n;
        try {
            n = source.read(buffer, bufferSize, buffer.length - bufferSize);
        } catch (IOException e) {
            throw BitStreamException.io(e);
        }
        if (n <= 0) {
            atEndOfSource = true;
            logger.debug("Source exhausted after {} bytes", bytesFetched);
            return false;
        }
        bufferSize += n;
        bytesFetched += n;
        logger.debug("Buffered {} bytes from source, {} unread", n, bufferSize);
        return true;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("BitStreamReader is closed");
        }
    }
}
