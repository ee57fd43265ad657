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

import io.github.varbits.annotations.VisibleForTesting;
import io.github.varbits.exceptions.BitStreamException;
import io.github.varbits.math.UInt128;
import io.github.varbits.util.BitUtil;

import java.util.Arrays;

/**
 * A growable, seekable bit container held entirely in memory.
 * <p>
 * The cursor is shared by reads and writes. Writing past the end extends the stream; writing after
 * {@link #seek(long)} back overwrites in place. Reads never go beyond {@link #length()}, and a failed
 * read leaves the cursor where it was.
 * <p>
 * Byte arrays passed in or handed out are copies. Not thread-safe.
 */
public class BitStream implements BitReader, BitWriter {
    private static final int DEFAULT_INITIAL_CAPACITY = 64;

    private byte[] storage;
    // bytes touched by bitLength; bits of storage beyond bitLength are always zero
    private int storageLength;
    private int bytePos;
    private int bitPos;
    private long bitLength;

    /**
     * Creates an empty stream.
     */
    public BitStream() {
        this(DEFAULT_INITIAL_CAPACITY);
    }

    /**
     * Creates an empty stream whose storage starts at {@code initialCapacity} bytes.
     */
    public BitStream(int initialCapacity) {
        if (initialCapacity < 0) {
            throw new IllegalArgumentException("initialCapacity must be non-negative: " + initialCapacity);
        }
        this.storage = new byte[initialCapacity];
    }

    /**
     * Creates a stream holding a copy of {@code bytes}, positioned at bit 0, with
     * {@code length() == bytes.length * 8}.
     */
    public BitStream(byte[] bytes) {
        this.storage = bytes.clone();
        this.storageLength = bytes.length;
        this.bitLength = (long) bytes.length * Byte.SIZE;
    }

    @Override
    public long position() {
        return (long) bytePos * Byte.SIZE + bitPos;
    }

    /**
     * Moves the cursor to {@code position}.
     *
     * @throws IllegalArgumentException if {@code position} is negative
     * @throws BitStreamException {@code END_OF_STREAM} if {@code position > length()}
     */
    public void seek(long position) {
        if (position < 0) {
            throw new IllegalArgumentException("position must be non-negative: " + position);
        }
        if (position > bitLength) {
            throw BitStreamException.endOfStream();
        }
        bytePos = (int) (position / Byte.SIZE);
        bitPos = (int) (position % Byte.SIZE);
    }

    /**
     * @return total number of valid bits
     */
    public long length() {
        return bitLength;
    }

    public boolean isEmpty() {
        return bitLength == 0;
    }

    /**
     * @return bits between the cursor and {@link #length()}
     */
    public long remaining() {
        return bitLength - position();
    }

    @Override
    public boolean isAtEnd() {
        return position() >= bitLength;
    }

    @Override
    public long readBits(int bitCount) {
        BitUtil.checkBitCount(bitCount, BitUtil.MAX_BITS);
        if (remaining() < bitCount) {
            throw BitStreamException.endOfStream();
        }
        long result = 0;
        int shift = 0;
        int left = bitCount;
        while (left > 0) {
            int n = BitPacking.chunk(bitPos, left);
            result |= BitPacking.extract(storage[bytePos], bitPos, n) << shift;
            shift += n;
            left -= n;
            advance(n);
        }
        return result;
    }

    @Override
    public UInt128 readBits128(int bitCount) {
        BitUtil.checkBitCount(bitCount, BitUtil.MAX_WIDE_BITS);
        if (remaining() < bitCount) {
            throw BitStreamException.endOfStream();
        }
        return BitReader.super.readBits128(bitCount);
    }

    @Override
    public byte[] readBytes(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be non-negative: " + count);
        }
        if (remaining() < (long) count * Byte.SIZE) {
            throw BitStreamException.endOfStream();
        }
        return BitReader.super.readBytes(count);
    }

    @Override
    public void skipBits(long bitCount) {
        if (bitCount < 0) {
            throw new IllegalArgumentException("bitCount must be non-negative: " + bitCount);
        }
        if (remaining() < bitCount) {
            throw BitStreamException.endOfStream();
        }
        seek(position() + bitCount);
    }

    @Override
    public void writeBits(long value, int bitCount) {
        BitUtil.checkBitCount(bitCount, BitUtil.MAX_BITS);
        ensureCapacity(BitUtil.bytesForBits(position() + bitCount));
        int left = bitCount;
        while (left > 0) {
            int n = BitPacking.chunk(bitPos, left);
            storage[bytePos] = BitPacking.deposit(storage[bytePos], bitPos, n, value);
            value >>>= n;
            left -= n;
            advance(n);
        }
        extendTo(position());
    }

    /**
     * When reading, skips to the next byte boundary. At the end of the stream this pads the current
     * byte with zero bits, extending {@link #length()}.
     */
    @Override
    public void alignToByte() {
        if (bitPos == 0) {
            return;
        }
        long aligned = (long) (bytePos + 1) * Byte.SIZE;
        ensureCapacity(BitUtil.bytesForBits(aligned));
        extendTo(aligned);
        bytePos++;
        bitPos = 0;
    }

    /**
     * @return a copy of the bytes holding {@link #length()} bits; unused high bits of the last byte are zero
     */
    public byte[] toByteArray() {
        return Arrays.copyOf(storage, storageLength);
    }

    /**
     * Empties the stream and moves the cursor to 0. Storage is kept for reuse.
     */
    public void reset() {
        Arrays.fill(storage, 0, storageLength, (byte) 0);
        storageLength = 0;
        bitLength = 0;
        bytePos = 0;
        bitPos = 0;
    }

    @VisibleForTesting
    int capacity() {
        return storage.length;
    }

    private void advance(int bits) {
        bitPos += bits;
        if (bitPos == Byte.SIZE) {
            bitPos = 0;
            bytePos++;
        }
    }

    private void extendTo(long bitPosition) {
        if (bitPosition > bitLength) {
            bitLength = bitPosition;
            storageLength = (int) BitUtil.bytesForBits(bitLength);
        }
    }

    private void ensureCapacity(long requiredBytes) {
        if (requiredBytes > Integer.MAX_VALUE - 8) {
            throw new IllegalStateException("BitStream cannot grow beyond " + (Integer.MAX_VALUE - 8) + " bytes");
        }
        if (requiredBytes <= storage.length) {
            return;
        }
        long grown = Math.max(requiredBytes, (long) storage.length * 2);
        storage = Arrays.copyOf(storage, (int) Math.min(grown, Integer.MAX_VALUE - 8));
    }
}
