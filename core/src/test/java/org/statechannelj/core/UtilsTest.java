/*
 * Copyright by the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.statechannelj.core;

import org.junit.After;
import org.junit.Test;

import java.math.BigInteger;

import static org.junit.Assert.*;

public class UtilsTest {

    @After
    public void tearDown() {
        Utils.resetMocking();
    }

    @Test
    public void uint256IsLeftPaddedBigEndian() {
        byte[] word = Utils.uint256(BigInteger.valueOf(0x0102));
        assertEquals(32, word.length);
        assertEquals(0x01, word[30]);
        assertEquals(0x02, word[31]);
        for (int i = 0; i < 30; i++)
            assertEquals(0, word[i]);
        assertArrayEquals(word, Utils.uint256(0x0102L));
    }

    @Test
    public void uint256AcceptsTheLargestWord() {
        byte[] word = Utils.uint256(Utils.MAX_UINT256);
        for (byte b : word)
            assertEquals((byte) 0xff, b);
    }

    @Test(expected = IllegalArgumentException.class)
    public void uint256RejectsOverflow() {
        Utils.uint256(Utils.MAX_UINT256.add(BigInteger.ONE));
    }

    @Test(expected = IllegalArgumentException.class)
    public void uint256RejectsNegative() {
        Utils.uint256(BigInteger.valueOf(-1));
    }

    @Test
    public void bigIntegerToBytesDropsSignByte() {
        // 0x80 needs a leading zero in two's complement.
        byte[] bytes = Utils.bigIntegerToBytes(BigInteger.valueOf(0x80), 1);
        assertArrayEquals(new byte[] { (byte) 0x80 }, bytes);
    }

    @Test
    public void parseHexAcceptsPrefix() {
        assertArrayEquals(new byte[] { 0x0a, (byte) 0xbc }, Utils.parseHex("0x0ABC"));
        assertArrayEquals(new byte[] { 0x0a, (byte) 0xbc }, Utils.parseHex("0abc"));
    }

    @Test
    public void mockClock() {
        Utils.setMockClock(1500000000L);
        assertEquals(1500000000L, Utils.currentTimeSeconds());
        Utils.rollMockClock(60);
        assertEquals(1500000060L, Utils.currentTimeSeconds());
        Utils.resetMocking();
        assertTrue(Utils.currentTimeSeconds() > 1500000060L);
    }

    @Test(expected = IllegalStateException.class)
    public void rollingRequiresMockClock() {
        Utils.rollMockClock(1);
    }
}
