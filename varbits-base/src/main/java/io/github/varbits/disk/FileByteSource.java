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
 * A {@link ByteSource} reading a file sequentially through a {@code FileChannel}.
 */
public class FileByteSource implements ByteSource {
    private final FileChannel channel;

    public FileByteSource(FileChannel channel) {
        this.channel = channel;
    }

    /**
     * Opens {@code path} for reading from its first byte.
     *
     * @throws IOException if the file cannot be opened
     */
    public static FileByteSource open(Path path) throws IOException {
        return new FileByteSource(FileChannel.open(path, StandardOpenOption.READ));
    }

    /**
     * @return the current byte offset in the file
     */
    public long position() throws IOException {
        return channel.position();
    }

    @Override
    public int read(byte[] buffer, int offset, int length) throws IOException {
        return channel.read(ByteBuffer.wrap(buffer, offset, length));
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }
}
