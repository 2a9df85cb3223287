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

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The 256 bit identifier of a channel instance.
 */
public final class ChannelId {
    private final Keccak256Hash hash;

    private ChannelId(Keccak256Hash hash) {
        this.hash = checkNotNull(hash);
    }

    public static ChannelId wrap(Keccak256Hash hash) {
        return new ChannelId(hash);
    }

    public static ChannelId fromHex(String hex) {
        return new ChannelId(Keccak256Hash.wrap(hex));
    }

    /**
     * Derives the id of a channel opened by {@code opener} towards {@code counterparty} over {@code asset} at the
     * given time: keccak256(opener || counterparty || asset || uint256(creationTimeSeconds)).
     */
    public static ChannelId derive(Address opener, Address counterparty, Address asset, long creationTimeSeconds) {
        return new ChannelId(Keccak256Hash.of(opener.getBytes(), counterparty.getBytes(), asset.getBytes(),
                Utils.uint256(creationTimeSeconds)));
    }

    /** Returns the raw 32 bytes. Do NOT modify the returned array. */
    public byte[] getBytes() {
        return hash.getBytes();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return hash.equals(((ChannelId) o).hash);
    }

    @Override
    public int hashCode() {
        return hash.hashCode();
    }

    @Override
    public String toString() {
        return hash.toString();
    }
}
