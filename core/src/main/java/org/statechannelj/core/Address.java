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

import com.google.common.primitives.UnsignedBytes;

import java.util.Arrays;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * <p>A 20 byte account identifier, as used for channel agents, assets and the verifying contract. Agents are referenced
 * by value everywhere, an Address never points back at the channel or key it came from.</p>
 *
 * <p>The all-zero address is the null identity. It is never a valid channel party, and as an asset it denotes the
 * native currency of the ledger.</p>
 */
public final class Address implements Comparable<Address> {
    public static final int LENGTH = 20;

    /** The null identity. */
    public static final Address ZERO = new Address(new byte[LENGTH]);

    private final byte[] bytes;

    private Address(byte[] bytes) {
        checkArgument(bytes.length == LENGTH, "Address must be %s bytes, got %s", LENGTH, bytes.length);
        this.bytes = bytes;
    }

    public static Address wrap(byte[] bytes) {
        return new Address(checkNotNull(bytes).clone());
    }

    /** Parses a hex address, with or without 0x prefix. Mixed-case checksums are accepted but not validated. */
    public static Address fromHex(String hex) {
        return new Address(Utils.parseHex(checkNotNull(hex)));
    }

    /** Takes the low 20 bytes of a 32 byte hash, which is how public keys map onto addresses. */
    public static Address fromHash(Keccak256Hash hash) {
        return new Address(Arrays.copyOfRange(hash.getBytes(), Keccak256Hash.LENGTH - LENGTH, Keccak256Hash.LENGTH));
    }

    public byte[] getBytes() {
        return bytes.clone();
    }

    /** Returns the address left padded to a 32 byte word. */
    public byte[] toWord() {
        byte[] word = new byte[32];
        System.arraycopy(bytes, 0, word, 32 - LENGTH, LENGTH);
        return word;
    }

    public boolean isZero() {
        return equals(ZERO);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(bytes, ((Address) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public int compareTo(Address other) {
        return UnsignedBytes.lexicographicalComparator().compare(bytes, other.bytes);
    }

    @Override
    public String toString() {
        return "0x" + Utils.HEX.encode(bytes);
    }
}
