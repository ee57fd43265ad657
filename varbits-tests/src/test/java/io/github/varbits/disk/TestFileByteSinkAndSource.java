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

import com.carrotsearch.randomizedtesting.RandomizedTest;
import com.carrotsearch.randomizedtesting.annotations.ThreadLeakScope;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.Assert.*;

@ThreadLeakScope(ThreadLeakScope.Scope.NONE)
public class TestFileByteSinkAndSource extends RandomizedTest {
    private Path testDirectory;
    private Path testFile;

    @Before
    public void setUp() throws IOException {
        testDirectory = Files.createTempDirectory(this.getClass().getSimpleName());
        testFile = testDirectory.resolve("bits.bin");
    }

    @After
    public void tearDown() throws IOException {
        Files.deleteIfExists(testFile);
        Files.deleteIfExists(testDirectory);
    }

    @Test
    public void testWriteThenRead() throws IOException {
        byte[] data = new byte[randomIntBetween(1, 10_000)];
        getRandom().nextBytes(data);

        try (FileByteSink sink = FileByteSink.create(testFile)) {
            sink.write(data, 0, data.length / 2);
            sink.write(data, data.length / 2, data.length - data.length / 2);
            sink.flush();
            assertEquals(data.length, sink.bytesWritten());
        }
        assertArrayEquals(data, Files.readAllBytes(testFile));

        byte[] read = new byte[data.length];
        try (FileByteSource source = FileByteSource.open(testFile)) {
            int total = 0;
            int n;
            while ((n = source.read(read, total, Math.min(4096, read.length - total))) > 0) {
                total += n;
            }
            assertEquals(data.length, total);
            assertEquals(data.length, source.position());
        }
        assertArrayEquals(data, read);
    }

    @Test
    public void testCreateTruncatesExistingFile() throws IOException {
        Files.write(testFile, new byte[100]);
        try (FileByteSink sink = FileByteSink.create(testFile)) {
            sink.write(new byte[] {1, 2});
        }
        assertEquals(2, Files.size(testFile));
    }
}
