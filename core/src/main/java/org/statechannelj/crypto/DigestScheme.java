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

import java.math.BigInteger;

/**
 * <p>Turns a channel state into the exact digest a wallet signs. Both agents and the validator must use the same
 * scheme: a state signed under one wrapping never verifies under another, and nothing else in the channel will
 * notice the mismatch, so schemes are pinned by test vectors.</p>
 */
public interface DigestScheme {

    /** Returns the digest to be signed, and verified, for the given channel state. */
    Keccak256Hash digest(ChannelId channelId, long nonce, BigInteger balanceA, BigInteger balanceB);
}
