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
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * A {@link ByteSink} writing a file sequentially through a {@code FileChannel}.
 * {@link #flush()} forces written content to the storage device.
 */
public class FileByteSink implements ByteSink {
    private final FileChannel channel;
    private long bytesWritten;

    public FileByteSink(FileChannel channel) {
        this.channel = channel;
    }

    /**
     * Creates {@code path}, or truncates it if it exists, and opens it for writing.
     *
     * @throws IOException if the file cannot be opened
     */
    public static FileByteSink create(Path path) throws IOException {
        return new FileByteSink(FileChannel.open(path,
                                                 StandardOpenOption.CREATE,
                                                 StandardOpenOption.TRUNCATE_EXISTING,
                                                 StandardOpenOption.WRITE));
    }

    /**
     * @return the number of bytes written through this sink
     */
    public long bytesWritten() {
        return bytesWritten;
    }

    @Override
    public void write(byte[] buffer, int offset, int length) throws IOException {
        ByteBuffer bb = ByteBuffer.wrap(buffer, offset, length);
        while (bb.hasRemaining()) {
            channel.write(bb);
        }
        bytesWritten += length;
    }

    @Override
    public void flush() throws IOException {
        channel.force(false);
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }
}
