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

import org.statechannelj.core.Address;
import org.statechannelj.core.ChannelId;
import org.statechannelj.core.Keccak256Hash;
import org.statechannelj.core.Utils;
import org.statechannelj.params.NetworkParameters;

import java.math.BigInteger;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * <p>EIP-712 structured-data wrapping of a channel state. The signed digest is</p>
 *
 * <pre>
 * keccak256(0x19 0x01 || domainSeparator || keccak256(CHANNEL_STATE_TYPEHASH || channelId || nonce || balanceA || balanceB))
 * </pre>
 *
 * <p>with the domain separator built from the {@link NetworkParameters} domain name, version and chain id plus the
 * address of the verifying channel manager.</p>
 */
public class TypedDataDigestScheme implements DigestScheme {
    public static final String EIP712_DOMAIN_TYPE =
            "EIP712Domain(string name,string version,uint256 chainId,address verifyingContract)";
    public static final String CHANNEL_STATE_TYPE =
            "ChannelState(bytes32 channelId,uint256 nonce,uint256 balanceA,uint256 balanceB)";

    public static final Keccak256Hash EIP712_DOMAIN_TYPEHASH = Keccak256Hash.ofString(EIP712_DOMAIN_TYPE);
    public static final Keccak256Hash CHANNEL_STATE_TYPEHASH = Keccak256Hash.ofString(CHANNEL_STATE_TYPE);

    private static final byte[] PREFIX = new byte[] { 0x19, 0x01 };

    private final Keccak256Hash domainSeparator;

    public TypedDataDigestScheme(NetworkParameters params, Address verifyingContract) {
        checkNotNull(params);
        checkNotNull(verifyingContract);
        this.domainSeparator = Keccak256Hash.of(
                EIP712_DOMAIN_TYPEHASH.getBytes(),
                Keccak256Hash.ofString(params.getDomainName()).getBytes(),
                Keccak256Hash.ofString(params.getDomainVersion()).getBytes(),
                Utils.uint256(params.getChainId()),
                verifyingContract.toWord());
    }

    public Keccak256Hash getDomainSeparator() {
        return domainSeparator;
    }

    /** Returns hashStruct(ChannelState) for the given state. */
    public static Keccak256Hash structHash(ChannelId channelId, long nonce, BigInteger balanceA, BigInteger balanceB) {
        return Keccak256Hash.of(CHANNEL_STATE_TYPEHASH.getBytes(), channelId.getBytes(), Utils.uint256(nonce),
                Utils.uint256(balanceA), Utils.uint256(balanceB));
    }

    @Override
    public Keccak256Hash digest(ChannelId channelId, long nonce, BigInteger balanceA, BigInteger balanceB) {
        return Keccak256Hash.of(PREFIX, domainSeparator.getBytes(),
                structHash(channelId, nonce, balanceA, balanceB).getBytes());
    }

    @Override
    public String toString() {
        return "TypedDataDigestScheme{domainSeparator=" + domainSeparator + "}";
    }
}
