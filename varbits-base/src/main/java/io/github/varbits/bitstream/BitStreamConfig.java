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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Buffer sizing for {@link BitStreamReader} and {@link BitStreamWriter}.
 * <p>
 * The default capacity can be overridden with the {@code varbits.bufferSize} system property.
 */
public final class BitStreamConfig {
    private static final Logger logger = LoggerFactory.getLogger(BitStreamConfig.class);

    public static final String BUFFER_SIZE_PROPERTY = "varbits.bufferSize";

    public static final int DEFAULT_BUFFER_SIZE = 4096;

    /** Smallest buffer that holds a 64-bit field at any bit offset plus a carried partial byte. */
    public static final int MIN_BUFFER_SIZE = 16;

    private static final int defaultBufferSize = resolveBufferSize(System.getProperty(BUFFER_SIZE_PROPERTY));

    private BitStreamConfig() {
    }

    /**
     * @return the buffer capacity used when a reader or writer is constructed without one
     */
    public static int defaultBufferSize() {
        return defaultBufferSize;
    }

    /**
     * Validates an explicit buffer capacity.
     *
     * @return {@code capacity}
     * @throws IllegalArgumentException if {@code capacity} is below {@link #MIN_BUFFER_SIZE}
     */
    public static int checkBufferSize(int capacity) {
        if (capacity < MIN_BUFFER_SIZE) {
            throw new IllegalArgumentException(String.format("Buffer capacity must be at least %d bytes, got %d",
                                                             MIN_BUFFER_SIZE, capacity));
        }
        return capacity;
    }

    @VisibleForTesting
    static int resolveBufferSize(String property) {
        if (property == null) {
            return DEFAULT_BUFFER_SIZE;
        }
        int value;
        try {
            value = Integer.parseInt(property.trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring {}={}: not an integer, using {}", BUFFER_SIZE_PROPERTY, property, DEFAULT_BUFFER_SIZE);
            return DEFAULT_BUFFER_SIZE;
        }
        if (value < MIN_BUFFER_SIZE) {
            logger.warn("Ignoring {}={}: must be at least {}, using {}",
                        BUFFER_SIZE_PROPERTY, value, MIN_BUFFER_SIZE, DEFAULT_BUFFER_SIZE);
            return DEFAULT_BUFFER_SIZE;
        }
        return value;
    }
}
