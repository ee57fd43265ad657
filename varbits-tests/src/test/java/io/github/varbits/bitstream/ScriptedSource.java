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

import java.io.IOException;

/**
 * In-memory source that hands out at most {@code maxPerRead} bytes per call and can be told to fail.
 */
class ScriptedSource implements ByteSource {
    private final byte[] data;
    private final int maxPerRead;
    private int pos;
    boolean failReads;
    int readCalls;
    int closeCalls;

    ScriptedSource(byte[] data) {
        this(data, Integer.MAX_VALUE);
    }

    ScriptedSource(byte[] data, int maxPerRead) {
        this.data = data;
        this.maxPerRead = maxPerRead;
    }

    @Override
    public int read(byte[] buffer, int offset, int length) throws IOException {
        readCalls++;
        if (failReads) {
            throw new IOException("simulated read failure");
        }
        if (pos == data.length) {
            return 0;
        }
        int n = Math.min(Math.min(length, maxPerRead), data.length - pos);
        System.arraycopy(data, pos, buffer, offset, n);
        pos += n;
        return n;
    }

    @Override
    public void close() {
        closeCalls++;
    }
}
