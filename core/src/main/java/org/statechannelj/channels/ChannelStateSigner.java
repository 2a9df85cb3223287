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

package org.statechannelj.channels;

import org.statechannelj.core.ChannelId;
import org.statechannelj.crypto.DigestScheme;
import org.statechannelj.crypto.ECKey;

import java.math.BigInteger;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Off-channel helper for agents: signs channel states with the same {@link DigestScheme} the channel manager verifies
 * them with. Obtain one matching a manager from {@link ChannelManager#getDigestScheme()}.
 */
public class ChannelStateSigner {
    private final DigestScheme digestScheme;

    public ChannelStateSigner(DigestScheme digestScheme) {
        this.digestScheme = checkNotNull(digestScheme);
    }

    /** Returns the 65 byte signature of {@code key} over the given state. */
    public byte[] sign(ECKey key, ChannelId channelId, long nonce, BigInteger balanceA, BigInteger balanceB) {
        return key.sign(digestScheme.digest(channelId, nonce, balanceA, balanceB)).encode();
    }

    /** Builds a fully signed update, as the two agents would after exchanging their signatures. */
    public StateUpdate createUpdate(ChannelId channelId, long nonce, BigInteger balanceA, BigInteger balanceB,
                                    ECKey keyA, ECKey keyB) {
        return new StateUpdate(nonce, balanceA, balanceB,
                sign(keyA, channelId, nonce, balanceA, balanceB),
                sign(keyB, channelId, nonce, balanceA, balanceB));
    }
}
