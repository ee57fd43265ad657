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

import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;

import static org.junit.Assert.*;

public class TestByteSources {

    @Test
    public void testByteBufferSourceLeavesCallerBufferUntouched() {
        ByteBuffer buffer = ByteBuffer.wrap(new byte[] {1, 2, 3, 4, 5});
        ByteBufferByteSource source = new ByteBufferByteSource(buffer);

        byte[] dest = new byte[3];
        assertEquals(3, source.read(dest, 0, 3));
        assertArrayEquals(new byte[] {1, 2, 3}, dest);
        assertEquals(2, source.remaining());
        assertEquals(2, source.read(dest, 0, 3));
        assertEquals(-1, source.read(dest, 0, 3));
        assertEquals(0, buffer.position());
    }

    @Test
    public void testStreamAdapters() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ByteSink sink = ByteSink.of(out)) {
            sink.write(new byte[] {10, 20, 30});
            sink.flush();
        }
        assertArrayEquals(new byte[] {10, 20, 30}, out.toByteArray());

        try (ByteSource source = ByteSource.of(new ByteArrayInputStream(out.toByteArray()))) {
            byte[] dest = new byte[8];
            assertEquals(3, source.read(dest, 0, 8));
            assertEquals(-1, source.read(dest, 0, 8));
        }
    }
}
