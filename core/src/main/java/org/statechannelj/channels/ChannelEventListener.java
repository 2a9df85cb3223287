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

import org.statechannelj.core.Address;
import org.statechannelj.core.ChannelId;

import java.math.BigInteger;

/**
 * <p>Implementors are notified of every lifecycle change a {@link ChannelManager} makes. Wallets, indexers and dispute
 * monitors use these to learn that a counterparty has started a challenge in time to respond with a newer state.</p>
 *
 * <p>Each event is delivered once, after the change it describes has fully taken effect. It may be convenient to derive
 * from {@link AbstractChannelEventListener} instead.</p>
 */
public interface ChannelEventListener {
    void onChannelOpen(ChannelId id, Address agentA, Address agentB, Address asset, BigInteger depositA,
                       long challengePeriod);

    void onChannelJoin(ChannelId id, Address agentA, Address agentB, Address asset, BigInteger depositA,
                       BigInteger depositB);

    void onChannelUpdateState(ChannelId id, long nonce, BigInteger balanceA, BigInteger balanceB);

    /** Called when a challenge starts. {@code closeTime} is in seconds since the epoch. */
    void onChannelChallenge(ChannelId id, long closeTime);

    void onChannelClose(ChannelId id);
}
