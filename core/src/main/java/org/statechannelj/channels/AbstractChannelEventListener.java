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
 * Convenience implementation of {@link ChannelEventListener}.
 */
public class AbstractChannelEventListener implements ChannelEventListener {
    @Override
    public void onChannelOpen(ChannelId id, Address agentA, Address agentB, Address asset, BigInteger depositA,
                              long challengePeriod) {
    }

    @Override
    public void onChannelJoin(ChannelId id, Address agentA, Address agentB, Address asset, BigInteger depositA,
                              BigInteger depositB) {
    }

    @Override
    public void onChannelUpdateState(ChannelId id, long nonce, BigInteger balanceA, BigInteger balanceB) {
    }

    @Override
    public void onChannelChallenge(ChannelId id, long closeTime) {
    }

    @Override
    public void onChannelClose(ChannelId id) {
    }
}
