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

import com.google.common.base.MoreObjects;
import com.google.common.collect.Multimap;
import com.google.common.collect.MultimapBuilder;
import org.statechannelj.core.Address;
import org.statechannelj.core.ChannelId;
import org.statechannelj.utils.StateMachine;

import javax.annotation.Nullable;
import java.math.BigInteger;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * <p>The record of one channel: the two agents, the escrowed asset, what each agent deposited and what each would
 * receive if the channel settled now.</p>
 *
 * <p>Instances returned by {@link ChannelManager#getChannel(ChannelId)} are snapshots. Only the manager mutates the
 * records it owns, and it keeps {@code balanceA + balanceB == depositA + depositB} at all times.</p>
 */
public class Channel {

    /**
     * The lifecycle of a channel. A channel starts {@link #OPEN} with only the opener's deposit, becomes {@link #JOINED}
     * once the counterparty deposits, and enters {@link #CHALLENGE} when either agent starts the countdown to
     * settlement. {@link #CLOSED} is terminal; closed records are removed from the registry.
     */
    public enum Status {
        OPEN,
        JOINED,
        CHALLENGE,
        CLOSED
    }

    private static final Multimap<Status, Status> TRANSITIONS = buildTransitions();

    private static Multimap<Status, Status> buildTransitions() {
        Multimap<Status, Status> result = MultimapBuilder.enumKeys(Status.class).arrayListValues().build();
        result.put(Status.OPEN, Status.JOINED);
        result.put(Status.OPEN, Status.CHALLENGE);
        result.put(Status.JOINED, Status.CHALLENGE);
        result.put(Status.CHALLENGE, Status.CLOSED);
        return result;
    }

    private final ChannelId id;
    private final Address agentA;
    private final Address agentB;
    private final Address asset;
    private final BigInteger depositA;
    private final long challengePeriod;
    private final StateMachine<Status> stateMachine;

    private BigInteger depositB;
    private BigInteger balanceA;
    private BigInteger balanceB;
    private long nonce;
    private long closeTime;
    @Nullable private Address challenger;

    Channel(ChannelId id, Address agentA, Address agentB, Address asset, BigInteger depositA, long challengePeriod) {
        this.id = checkNotNull(id);
        this.agentA = checkNotNull(agentA);
        this.agentB = checkNotNull(agentB);
        this.asset = checkNotNull(asset);
        this.depositA = checkNotNull(depositA);
        checkArgument(challengePeriod > 0);
        this.challengePeriod = challengePeriod;
        this.stateMachine = new StateMachine<>(Status.OPEN, TRANSITIONS);
        this.depositB = BigInteger.ZERO;
        this.balanceA = depositA;
        this.balanceB = BigInteger.ZERO;
    }

    private Channel(Channel other) {
        this.id = other.id;
        this.agentA = other.agentA;
        this.agentB = other.agentB;
        this.asset = other.asset;
        this.depositA = other.depositA;
        this.challengePeriod = other.challengePeriod;
        this.stateMachine = new StateMachine<>(other.getStatus(), TRANSITIONS);
        this.depositB = other.depositB;
        this.balanceA = other.balanceA;
        this.balanceB = other.balanceB;
        this.nonce = other.nonce;
        this.closeTime = other.closeTime;
        this.challenger = other.challenger;
    }

    /** Returns an independent copy of this record. */
    Channel copy() {
        return new Channel(this);
    }

    void join(BigInteger deposit) {
        stateMachine.transition(Status.JOINED);
        depositB = deposit;
        balanceB = deposit;
    }

    void applyState(long nonce, BigInteger balanceA, BigInteger balanceB) {
        stateMachine.checkState(Status.JOINED, Status.CHALLENGE);
        checkArgument(nonce > this.nonce, "Stale nonce %s <= %s", nonce, this.nonce);
        checkArgument(balanceA.add(balanceB).equals(getTotalDeposit()), "Balances do not conserve the deposit");
        this.nonce = nonce;
        this.balanceA = balanceA;
        this.balanceB = balanceB;
    }

    void startChallenge(Address challenger, long closeTime) {
        stateMachine.transition(Status.CHALLENGE);
        this.challenger = challenger;
        this.closeTime = closeTime;
    }

    void close() {
        stateMachine.transition(Status.CLOSED);
    }

    public ChannelId getId() {
        return id;
    }

    /** The agent who opened the channel. */
    public Address getAgentA() {
        return agentA;
    }

    /** The counterparty named at open time, the only identity allowed to join. */
    public Address getAgentB() {
        return agentB;
    }

    public Address getAsset() {
        return asset;
    }

    public BigInteger getDepositA() {
        return depositA;
    }

    /** Zero until the channel is joined. */
    public BigInteger getDepositB() {
        return depositB;
    }

    public BigInteger getTotalDeposit() {
        return depositA.add(depositB);
    }

    public BigInteger getBalanceA() {
        return balanceA;
    }

    public BigInteger getBalanceB() {
        return balanceB;
    }

    public Status getStatus() {
        return stateMachine.getState();
    }

    /** Seconds between the start of a challenge and the earliest moment the channel may be closed. */
    public long getChallengePeriod() {
        return challengePeriod;
    }

    /** The nonce of the last accepted state update, 0 if none was accepted yet. */
    public long getNonce() {
        return nonce;
    }

    /** Seconds since the epoch after which the channel may be closed, or 0 if no challenge was started. */
    public long getCloseTime() {
        return closeTime;
    }

    /** The agent who started the challenge, or null if none was started. */
    @Nullable
    public Address getChallenger() {
        return challenger;
    }

    /** Returns true if the given identity is one of the two agents. */
    public boolean isParty(Address identity) {
        return agentA.equals(identity) || agentB.equals(identity);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues()
                .add("id", id)
                .add("status", getStatus())
                .add("agentA", agentA)
                .add("agentB", agentB)
                .add("asset", asset)
                .add("depositA", depositA)
                .add("depositB", depositB)
                .add("balanceA", balanceA)
                .add("balanceB", balanceB)
                .add("nonce", nonce)
                .add("challengePeriod", challengePeriod)
                .add("closeTime", closeTime)
                .add("challenger", challenger)
                .toString();
    }
}
