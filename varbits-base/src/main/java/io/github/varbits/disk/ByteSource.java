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

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;

/**
 * A source of bytes consumed by {@code BitStreamReader}.
 * <p>
 * Implementations are expected to be stateful and NOT threadsafe.
 */
public interface ByteSource extends Closeable {
    /**
     * Reads up to {@code length} bytes into {@code buffer}. Implementations may return fewer bytes than
     * requested without being at the end of the data.
     *
     * @param buffer the destination
     * @param offset the first index of {@code buffer} to fill
     * @param length the maximum number of bytes to read
     * @return the number of bytes read, or {@code 0} or {@code -1} at end-of-data
     * @throws IOException if the medium fails
     */
    int read(byte[] buffer, int offset, int length) throws IOException;

    /**
     * Wraps an {@code InputStream}. Closing the returned source closes the stream.
     *
     * @param in the stream to read from
     * @return a source reading from {@code in}
     */
    static ByteSource of(InputStream in) {
        return new StreamByteSource(in);
    }
}
