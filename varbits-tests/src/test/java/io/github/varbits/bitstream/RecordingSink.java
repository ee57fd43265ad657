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

import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * In-memory sink that records what it receives and can be told to fail.
 */
class RecordingSink implements ByteSink {
    private final ByteArrayOutputStream data = new ByteArrayOutputStream();
    boolean failWrites;
    boolean failFlush;
    boolean failClose;
    int writeCalls;
    int flushCalls;
    int closeCalls;

    @Override
    public void write(byte[] buffer, int offset, int length) throws IOException {
        writeCalls++;
        if (failWrites) {
            throw new IOException("simulated write failure");
        }
        data.write(buffer, offset, length);
    }

    @Override
    public void flush() throws IOException {
        flushCalls++;
        if (failFlush) {
            throw new IOException("simulated flush failure");
        }
    }

    @Override
    public void close() throws IOException {
        closeCalls++;
        if (failClose) {
            throw new IOException("simulated close failure");
        }
    }

    byte[] bytes() {
        return data.toByteArray();
    }
}
