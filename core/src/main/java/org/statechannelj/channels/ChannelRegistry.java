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

import javax.annotation.Nullable;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * <p>Owns the live channel records. Records are stored by id, and an index maps each (agentA, agentB, asset) triple to
 * the id of its active channel so that two agents can never share more than one channel per asset at a time.</p>
 *
 * <p>This class is not thread safe. {@link ChannelManager} only touches it while holding its own lock.</p>
 */
public class ChannelRegistry {

    private static final class IndexKey {
        final Address agentA;
        final Address agentB;
        final Address asset;

        IndexKey(Address agentA, Address agentB, Address asset) {
            this.agentA = agentA;
            this.agentB = agentB;
            this.asset = asset;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            IndexKey other = (IndexKey) o;
            return agentA.equals(other.agentA) && agentB.equals(other.agentB) && asset.equals(other.asset);
        }

        @Override
        public int hashCode() {
            return Objects.hash(agentA, agentB, asset);
        }
    }

    private final Map<ChannelId, Channel> channels = new HashMap<>();
    private final Map<IndexKey, ChannelId> activeIds = new HashMap<>();

    /**
     * Returns the id of the active channel between the two identities over the asset, in either role order, or null
     * if there is none.
     */
    @Nullable
    public ChannelId findActiveChannel(Address first, Address second, Address asset) {
        ChannelId id = activeIds.get(new IndexKey(first, second, asset));
        if (id == null)
            id = activeIds.get(new IndexKey(second, first, asset));
        return id;
    }

    /**
     * Fails with {@link ChannelException.Reason#DUPLICATE_CHANNEL} if the pair already shares an active channel over
     * the asset.
     */
    public void checkNoActiveChannel(Address opener, Address counterparty, Address asset) throws ChannelException {
        ChannelId existing = findActiveChannel(opener, counterparty, asset);
        if (existing != null)
            throw new ChannelException(ChannelException.Reason.DUPLICATE_CHANNEL,
                    "Channel " + existing + " between " + opener + " and " + counterparty + " over " + asset +
                            " is still active");
    }

    /** Stores a freshly opened channel and indexes it. The caller must have checked for duplicates. */
    void register(Channel channel) {
        checkNotNull(channel);
        checkState(!channels.containsKey(channel.getId()), "Channel id already in use: %s", channel.getId());
        checkState(findActiveChannel(channel.getAgentA(), channel.getAgentB(), channel.getAsset()) == null,
                "Pair already has an active channel");
        channels.put(channel.getId(), channel);
        activeIds.put(new IndexKey(channel.getAgentA(), channel.getAgentB(), channel.getAsset()), channel.getId());
    }

    /**
     * Returns the live record for the id.
     *
     * @throws ChannelException with {@link ChannelException.Reason#NOT_FOUND} if there is no such channel.
     */
    public Channel lookup(ChannelId id) throws ChannelException {
        Channel channel = channels.get(checkNotNull(id));
        if (channel == null)
            throw new ChannelException(ChannelException.Reason.NOT_FOUND, "No channel " + id);
        return channel;
    }

    /** Deletes the record and its index entry. Only closing a channel removes it. */
    void remove(ChannelId id) {
        Channel channel = channels.remove(id);
        checkState(channel != null, "Removing unknown channel %s", id);
        ChannelId indexed = activeIds.remove(new IndexKey(channel.getAgentA(), channel.getAgentB(), channel.getAsset()));
        checkState(id.equals(indexed), "Index out of sync for channel %s", id);
    }

    public int size() {
        return channels.size();
    }
}
