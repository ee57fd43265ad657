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

package io.github.varbits.util;

import io.github.varbits.exceptions.BitStreamException;
import org.junit.Test;

import static org.junit.Assert.*;

public class TestBitUtil {
    @Test
    public void testMask() {
        assertEquals(0L, BitUtil.mask(0));
        assertEquals(7L, BitUtil.mask(3));
        assertEquals(0x7FFFFFFFFFFFFFFFL, BitUtil.mask(63));
        assertEquals(-1L, BitUtil.mask(64));
        assertEquals(0x34L, BitUtil.maskBits(0x1234L, 8));
    }

    @Test
    public void testCheckBitCount() {
        assertEquals(1, BitUtil.checkBitCount(1, BitUtil.MAX_BITS));
        assertEquals(128, BitUtil.checkBitCount(128, BitUtil.MAX_WIDE_BITS));
        for (int bad : new int[] {-1, 0, 65}) {
            var e = assertThrows(BitStreamException.class, () -> BitUtil.checkBitCount(bad, BitUtil.MAX_BITS));
            assertEquals(BitStreamException.ErrorType.INVALID_BIT_COUNT, e.getErrorType());
        }
    }

    @Test
    public void testBytesForBits() {
        assertEquals(0, BitUtil.bytesForBits(0));
        assertEquals(1, BitUtil.bytesForBits(1));
        assertEquals(1, BitUtil.bytesForBits(8));
        assertEquals(2, BitUtil.bytesForBits(9));
    }
}
