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

import com.carrotsearch.randomizedtesting.RandomizedTest;
import com.carrotsearch.randomizedtesting.annotations.ThreadLeakScope;
import io.github.varbits.disk.ByteBufferByteSink;
import io.github.varbits.exceptions.BitStreamException;
import io.github.varbits.exceptions.BitStreamException.ErrorType;
import io.github.varbits.math.UInt128;
import io.github.varbits.value.BitValue;
import org.junit.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;

import static org.junit.Assert.*;

@ThreadLeakScope(ThreadLeakScope.Scope.NONE)
public class TestBitStreamWriter extends RandomizedTest {

    @Test
    public void testLsbFirstPacking() {
        ByteBufferByteSink sink = ByteBufferByteSink.allocate(16);
        try (BitStreamWriter writer = new BitStreamWriter(sink)) {
            writer.writeBits(1, 1);
            writer.writeBits(0b010, 3);
            writer.writeBits(0b1010, 4);
            writer.writeBits(0b11110000, 8);
            writer.writeBits(0b00001111, 8);
        }
        assertArrayEquals(new byte[] {(byte) 0xA5, (byte) 0xF0, 0x0F}, sink.toByteArray());
    }

    @Test
    public void testFlushPadsPartialByteAndEndsIt() {
        RecordingSink sink = new RecordingSink();
        BitStreamWriter writer = new BitStreamWriter(sink);
        writer.writeBits(0b101, 3);
        assertEquals(3, writer.position());
        writer.flush();
        assertArrayEquals(new byte[] {0x05}, sink.bytes());
        assertEquals(8, writer.position());

        writer.writeBits(0xFF, 8);
        writer.flush();
        assertArrayEquals(new byte[] {0x05, (byte) 0xFF}, sink.bytes());
        assertEquals(2, writer.bytesWritten());
    }

    @Test
    public void testFlushIsIdempotent() {
        RecordingSink sink = new RecordingSink();
        BitStreamWriter writer = new BitStreamWriter(sink);
        writer.writeBits(0x3C, 7);
        writer.flush();
        writer.flush();
        assertArrayEquals(new byte[] {0x3C}, sink.bytes());
        assertEquals(1, sink.writeCalls);
        assertEquals(2, sink.flushCalls);
    }

    @Test
    public void testFullBufferIsHandedToSink() {
        RecordingSink sink = new RecordingSink();
        BitStreamWriter writer = new BitStreamWriter(sink, BitStreamConfig.MIN_BUFFER_SIZE);
        for (int i = 0; i < 40; i++) {
            writer.writeBits(i, 8);
        }
        // completed bytes reach the sink without an explicit flush
        assertTrue(sink.bytes().length >= 16);
        assertEquals(sink.bytes().length, writer.bytesWritten());
        writer.flush();
        byte[] bytes = sink.bytes();
        assertEquals(40, bytes.length);
        for (int i = 0; i < 40; i++) {
            assertEquals((byte) i, bytes[i]);
        }
    }

    @Test
    public void testFailedBufferFlushCanBeRetried() {
        RecordingSink sink = new RecordingSink();
        BitStreamWriter writer = new BitStreamWriter(sink, BitStreamConfig.MIN_BUFFER_SIZE);
        writer.writeBits(0b11, 2);
        for (int i = 0; i < 16; i++) {
            writer.writeBits(0xA0 + i, 8);
        }
        assertEquals(0, sink.bytes().length);

        sink.failWrites = true;
        var e = assertThrows(BitStreamException.class, () -> writer.writeBits(0x1F, 8));
        assertEquals(ErrorType.IO, e.getErrorType());
        assertTrue(e.getCause() instanceof IOException);
        assertEquals(2 + 16 * 8, writer.position());

        sink.failWrites = false;
        writer.writeBits(0x1F, 8);
        writer.flush();

        BitStream expected = new BitStream();
        expected.writeBits(0b11, 2);
        for (int i = 0; i < 16; i++) {
            expected.writeBits(0xA0 + i, 8);
        }
        expected.writeBits(0x1F, 8);
        assertArrayEquals(expected.toByteArray(), sink.bytes());
    }

    @Test
    public void testWideWriteAtMinimumCapacityLeavesWriterUnchangedOnFailure() {
        RecordingSink sink = new RecordingSink();
        BitStreamWriter writer = new BitStreamWriter(sink, BitStreamConfig.MIN_BUFFER_SIZE);
        BitStream expected = new BitStream();
        writer.writeBits(0b101, 3);
        expected.writeBits(0b101, 3);
        for (int i = 0; i < 15; i++) {
            writer.writeBits(0xC0 + i, 8);
            expected.writeBits(0xC0 + i, 8);
        }
        assertEquals(123, writer.position());

        sink.failWrites = true;
        var e = assertThrows(BitStreamException.class, () -> writer.writeBits128(UInt128.MAX_VALUE, 128));
        assertEquals(ErrorType.IO, e.getErrorType());
        assertEquals(123, writer.position());
        assertEquals(0, writer.bytesWritten());

        sink.failWrites = false;
        writer.writeBits128(UInt128.MAX_VALUE, 128);
        expected.writeBits128(UInt128.MAX_VALUE, 128);
        assertEquals(251, writer.position());
        writer.flush();
        assertArrayEquals(expected.toByteArray(), sink.bytes());
    }

    @Test
    public void testFailedFlushCanBeRetried() {
        RecordingSink sink = new RecordingSink();
        BitStreamWriter writer = new BitStreamWriter(sink);
        writer.writeBits(0x2AB, 10);
        sink.failWrites = true;
        var e = assertThrows(BitStreamException.class, writer::flush);
        assertEquals(ErrorType.IO, e.getErrorType());
        assertEquals(10, writer.position());

        sink.failWrites = false;
        writer.flush();
        assertArrayEquals(new byte[] {(byte) 0xAB, 0x02}, sink.bytes());
    }

    @Test
    public void testCloseFlushesAndClosesSink() {
        RecordingSink sink = new RecordingSink();
        BitStreamWriter writer = new BitStreamWriter(sink);
        writer.writeBits(0x7, 3);
        writer.close();
        writer.close();
        assertArrayEquals(new byte[] {0x07}, sink.bytes());
        assertEquals(1, sink.closeCalls);
        assertThrows(IllegalStateException.class, () -> writer.writeBits(1, 1));
        assertThrows(IllegalStateException.class, writer::flush);
    }

    @Test
    public void testLeaveOpen() {
        RecordingSink sink = new RecordingSink();
        try (BitStreamWriter writer = new BitStreamWriter(sink, 64, true)) {
            writer.writeBits(1, 1);
        }
        assertEquals(0, sink.closeCalls);
        assertArrayEquals(new byte[] {0x01}, sink.bytes());
    }

    @Test
    public void testCloseReportsFlushFailureWithCloseFailureSuppressed() {
        RecordingSink sink = new RecordingSink();
        BitStreamWriter writer = new BitStreamWriter(sink);
        writer.writeBits(1, 4);
        sink.failWrites = true;
        sink.failClose = true;
        var e = assertThrows(BitStreamException.class, writer::close);
        assertEquals("simulated write failure", e.getCause().getMessage());
        assertEquals(1, e.getSuppressed().length);
        assertEquals(1, sink.closeCalls);
    }

    @Test
    public void testCloseFailureSurfacesAsIo() {
        RecordingSink sink = new RecordingSink();
        sink.failClose = true;
        BitStreamWriter writer = new BitStreamWriter(sink);
        var e = assertThrows(BitStreamException.class, writer::close);
        assertEquals(ErrorType.IO, e.getErrorType());
    }

    @Test
    public void testWideValuesAcrossBufferBoundary() {
        RecordingSink sink = new RecordingSink();
        BitStream expected = new BitStream();
        try (BitStreamWriter writer = new BitStreamWriter(sink, BitStreamConfig.MIN_BUFFER_SIZE)) {
            for (int i = 0; i < 50; i++) {
                int bits = randomIntBetween(1, 128);
                UInt128 value = UInt128.of(getRandom().nextLong(), getRandom().nextLong());
                writer.writeBits128(value, bits);
                expected.writeBits128(value, bits);
                writer.writeBitValue(BitValue.ofSigned(-i, 7));
                expected.writeBitValue(BitValue.ofSigned(-i, 7));
            }
            assertEquals(expected.length(), writer.position());
        }
        assertArrayEquals(expected.toByteArray(), sink.bytes());
    }

    @Test
    public void testOutputStreamConstructor() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (BitStreamWriter writer = new BitStreamWriter(out)) {
            writer.writeBytes(new byte[] {1, 2, 3});
            writer.alignToByte();
            writer.writeBit(true);
            writer.alignToByte();
            writer.writeBits(0xEE, 8);
        }
        assertArrayEquals(new byte[] {1, 2, 3, 1, (byte) 0xEE}, out.toByteArray());
    }

    @Test
    public void testConstructorArguments() {
        assertThrows(IllegalArgumentException.class, () -> new BitStreamWriter(new RecordingSink(), 15));
        assertThrows(NullPointerException.class, () -> new BitStreamWriter((RecordingSink) null));
    }
}
