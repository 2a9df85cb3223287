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

package org.statechannelj.crypto;

import org.statechannelj.core.ChannelId;
import org.statechannelj.core.Keccak256Hash;
import org.statechannelj.core.Utils;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

/**
 * Wraps the state fingerprint the way {@code personal_sign} style wallets do:
 * keccak256("\x19Ethereum Signed Message:\n32" || fingerprint). Offered for wallets that cannot sign typed data.
 */
public class SignedMessageDigestScheme implements DigestScheme {
    private static final byte[] PREFIX = "\u0019Ethereum Signed Message:\n32".getBytes(StandardCharsets.UTF_8);

    @Override
    public Keccak256Hash digest(ChannelId channelId, long nonce, BigInteger balanceA, BigInteger balanceB) {
        Keccak256Hash fingerprint = fingerprint(channelId, nonce, balanceA, balanceB);
        return Keccak256Hash.of(PREFIX, fingerprint.getBytes());
    }

    /**
     * The canonical fingerprint of a channel state, without any wrapping:
     * keccak256(channelId || uint256(nonce) || uint256(balanceA) || uint256(balanceB)).
     */
    public static Keccak256Hash fingerprint(ChannelId channelId, long nonce, BigInteger balanceA,
                                            BigInteger balanceB) {
        return Keccak256Hash.of(channelId.getBytes(), Utils.uint256(nonce), Utils.uint256(balanceA),
                Utils.uint256(balanceB));
    }

    @Override
    public String toString() {
        return "SignedMessageDigestScheme";
    }
}
