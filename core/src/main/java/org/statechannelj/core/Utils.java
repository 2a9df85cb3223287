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

import com.google.common.io.BaseEncoding;

import java.math.BigInteger;
import java.util.concurrent.TimeUnit;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A collection of various utility methods that are helpful for working with channel state encodings and time.
 */
public class Utils {

    /** Hex encoding used throughout the library. */
    public static final BaseEncoding HEX = BaseEncoding.base16().lowerCase();

    /** The largest value representable as an unsigned 256 bit word. */
    public static final BigInteger MAX_UINT256 = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    private static volatile long mockTime;

    /**
     * <p>The regular {@link java.math.BigInteger#toByteArray()} includes the sign bit of the number and
     * might result in an extra byte addition. This method removes this extra byte.</p>
     * <p>Assuming only positive numbers, it's possible to discriminate if an extra byte
     * is added by checking if the first element of the array is 0 (0000_0000).
     * Moreover, the first element is 0 if and only if the highest bit of the second byte is set.</p>
     * @param b the integer to format into a byte array
     * @param numBytes the desired size of the resulting byte array
     * @return numBytes byte long array.
     */
    public static byte[] bigIntegerToBytes(BigInteger b, int numBytes) {
        checkArgument(b.signum() >= 0, "b must be positive or zero");
        checkArgument(numBytes > 0, "numBytes must be positive");
        byte[] src = b.toByteArray();
        byte[] dest = new byte[numBytes];
        boolean isFirstByteOnlyForSign = src[0] == 0;
        int length = isFirstByteOnlyForSign ? src.length - 1 : src.length;
        checkArgument(length <= numBytes, "The given number does not fit in " + numBytes);
        int srcPos = isFirstByteOnlyForSign ? 1 : 0;
        int destPos = numBytes - length;
        System.arraycopy(src, srcPos, dest, destPos, length);
        return dest;
    }

    /** Encodes the given value as a big endian, left padded, 32 byte word, the way the escrow contract ABI does. */
    public static byte[] uint256(BigInteger value) {
        checkUint256(value);
        return bigIntegerToBytes(value, 32);
    }

    /** Encodes the given non-negative value as a 32 byte word. */
    public static byte[] uint256(long value) {
        checkArgument(value >= 0, "Negative value: %s", value);
        return bigIntegerToBytes(BigInteger.valueOf(value), 32);
    }

    /** Throws {@link IllegalArgumentException} unless the value fits an unsigned 256 bit word. */
    public static BigInteger checkUint256(BigInteger value) {
        checkArgument(value.signum() >= 0, "Negative value: %s", value);
        checkArgument(value.compareTo(MAX_UINT256) <= 0, "Value does not fit 256 bits: %s", value);
        return value;
    }

    /** Decodes a hex string, with or without the 0x prefix. */
    public static byte[] parseHex(String hex) {
        String digits = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        return HEX.decode(digits.toLowerCase());
    }

    /**
     * Advances (or rewinds) the mock clock by the given number of seconds.
     */
    public static long rollMockClock(int seconds) {
        return rollMockClockMillis(seconds * 1000L);
    }

    /**
     * Advances (or rewinds) the mock clock by the given number of milliseconds.
     */
    public static long rollMockClockMillis(long millis) {
        if (mockTime == 0)
            throw new IllegalStateException("You need to use setMockClock() first.");
        mockTime = mockTime + millis;
        return mockTime;
    }

    /**
     * Sets the mock clock to the current time.
     */
    public static void setMockClock() {
        mockTime = System.currentTimeMillis();
    }

    /**
     * Sets the mock clock to the given time (in seconds).
     */
    public static void setMockClock(long mockClockSeconds) {
        mockTime = mockClockSeconds * 1000;
    }

    /**
     * Clears the mock clock and returns to the system clock.
     */
    public static void resetMocking() {
        mockTime = 0;
    }

    /**
     * Returns the current time in milliseconds since the epoch, or a mocked out equivalent.
     */
    public static long currentTimeMillis() {
        return mockTime != 0 ? mockTime : System.currentTimeMillis();
    }

    /**
     * Returns the current time in seconds since the epoch, or a mocked out equivalent.
     */
    public static long currentTimeSeconds() {
        return TimeUnit.MILLISECONDS.toSeconds(currentTimeMillis());
    }
}
