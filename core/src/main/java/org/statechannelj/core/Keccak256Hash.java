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

import com.google.common.primitives.Ints;
import com.google.common.primitives.UnsignedBytes;
import org.bouncycastle.crypto.digests.KeccakDigest;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A Keccak256Hash just wraps a byte[] so that equals and hashcode work correctly, allowing it to be used as keys in a
 * map. It also checks that the length is correct and provides a bit more type safety.
 *
 * <p>Note this is the original Keccak padding as used by Ethereum style contracts, not the standardised SHA3-256.</p>
 */
public class Keccak256Hash implements Comparable<Keccak256Hash> {
    public static final int LENGTH = 32; // bytes

    private final byte[] bytes;

    private Keccak256Hash(byte[] rawHashBytes) {
        checkArgument(rawHashBytes.length == LENGTH);
        this.bytes = rawHashBytes;
    }

    /**
     * Creates a new instance that wraps the given hash value.
     *
     * @param rawHashBytes the raw hash bytes to wrap
     * @return a new instance
     * @throws IllegalArgumentException if the given array length is not exactly 32
     */
    public static Keccak256Hash wrap(byte[] rawHashBytes) {
        return new Keccak256Hash(rawHashBytes.clone());
    }

    /**
     * Creates a new instance that wraps the given hash value (represented as a hex string).
     */
    public static Keccak256Hash wrap(String hexString) {
        return wrap(Utils.parseHex(hexString));
    }

    /**
     * Creates a new instance containing the calculated Keccak-256 hash of the concatenation of the given byte ranges.
     */
    public static Keccak256Hash of(byte[]... inputs) {
        return new Keccak256Hash(hash(inputs));
    }

    /**
     * Calculates the Keccak-256 hash of the concatenation of the given byte ranges.
     */
    public static byte[] hash(byte[]... inputs) {
        KeccakDigest digest = new KeccakDigest(256);
        for (byte[] input : inputs)
            digest.update(input, 0, input.length);
        byte[] out = new byte[LENGTH];
        digest.doFinal(out, 0);
        return out;
    }

    /** Hashes the UTF-8 encoding of the given string, as EIP-712 does for type strings and string members. */
    public static Keccak256Hash ofString(String s) {
        return of(s.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Returns the internal byte array, without defensively copying. Therefore do NOT modify the returned array.
     */
    public byte[] getBytes() {
        return bytes;
    }

    /**
     * Returns the bytes interpreted as a positive integer.
     */
    public BigInteger toBigInteger() {
        return new BigInteger(1, bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(bytes, ((Keccak256Hash) o).bytes);
    }

    /** Returns the last four bytes of the wrapped hash, which are uniformly distributed for any Keccak output. */
    @Override
    public int hashCode() {
        return Ints.fromBytes(bytes[LENGTH - 4], bytes[LENGTH - 3], bytes[LENGTH - 2], bytes[LENGTH - 1]);
    }

    @Override
    public String toString() {
        return "0x" + Utils.HEX.encode(bytes);
    }

    @Override
    public int compareTo(final Keccak256Hash other) {
        return UnsignedBytes.lexicographicalComparator().compare(bytes, other.bytes);
    }
}
