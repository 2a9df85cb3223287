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

import com.google.common.math.LongMath;
import net.jcip.annotations.GuardedBy;
import org.statechannelj.core.Address;
import org.statechannelj.core.ChannelId;
import org.statechannelj.core.Utils;
import org.statechannelj.crypto.DigestScheme;
import org.statechannelj.crypto.ECDSASignatureVerifier;
import org.statechannelj.crypto.SignatureVerifier;
import org.statechannelj.crypto.TypedDataDigestScheme;
import org.statechannelj.ledger.EscrowLedger;
import org.statechannelj.ledger.EscrowTransaction;
import org.statechannelj.ledger.EscrowTransferException;
import org.statechannelj.params.NetworkParameters;
import org.statechannelj.utils.ListenerRegistration;
import org.statechannelj.utils.Threading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.math.BigInteger;
import java.util.EnumSet;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantLock;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * <p>A two-party payment channel manager. Two agents lock collateral into a shared escrow, agree on balance updates
 * off-channel by signing them, and settle through a challenge: either agent may start a countdown of the channel's
 * challenge period, during which the latest mutually signed state can still be submitted, and once it has fully
 * elapsed either agent may close the channel and have the escrow pay out the recorded balances.</p>
 *
 * <p>The lifecycle is {@code OPEN -> JOINED -> CHALLENGE -> CLOSED}, with a direct {@code OPEN -> CHALLENGE} edge so that
 * an opener whose counterparty never joins can still recover the deposit. Closed channels are removed; looking one up
 * afterwards fails with {@link ChannelException.Reason#NOT_FOUND}.</p>
 *
 * <p>Every operation runs under a single lock and is all-or-nothing: it either completes, moving funds and mutating the
 * record, or throws a {@link ChannelException} having reversed any escrow transfer it already made. Nothing is retried
 * internally and there is no background timer; time is read from {@link Utils#currentTimeSeconds()}.</p>
 *
 * <p>Listeners added with {@link #addEventListener(ChannelEventListener)} are called on the operating thread, after the
 * change they describe has taken effect.</p>
 */
public class ChannelManager {
    private static final Logger log = LoggerFactory.getLogger(ChannelManager.class);

    /** The transitions an existing channel can go through, with who may request them and from which statuses. */
    private enum Transition {
        JOIN(true, Channel.Status.OPEN),
        UPDATE_STATE(false, Channel.Status.JOINED, Channel.Status.CHALLENGE),
        START_CHALLENGE(false, Channel.Status.OPEN, Channel.Status.JOINED),
        CLOSE(false, Channel.Status.CHALLENGE);

        final boolean counterpartyOnly;
        final EnumSet<Channel.Status> from;

        Transition(boolean counterpartyOnly, Channel.Status first, Channel.Status... rest) {
            this.counterpartyOnly = counterpartyOnly;
            this.from = EnumSet.of(first, rest);
        }
    }

    private interface Notification {
        void deliver(ChannelEventListener listener);
    }

    private final ReentrantLock lock = Threading.lock("ChannelManager");

    private final NetworkParameters params;
    private final Address address;
    private final EscrowLedger ledger;
    private final StateUpdateValidator validator;

    @GuardedBy("lock") private final ChannelRegistry registry = new ChannelRegistry();

    private final CopyOnWriteArrayList<ListenerRegistration<ChannelEventListener>> eventListeners
            = new CopyOnWriteArrayList<>();

    /**
     * Creates a manager that verifies ECDSA signatures over EIP-712 digests bound to the given network and to
     * {@code address}, the identity under which this manager is known to wallets.
     */
    public ChannelManager(NetworkParameters params, Address address, EscrowLedger ledger) {
        this(new Builder(params, address, ledger));
    }

    private ChannelManager(Builder builder) {
        this.params = checkNotNull(builder.params);
        this.address = checkNotNull(builder.address);
        this.ledger = checkNotNull(builder.ledger);
        SignatureVerifier verifier = builder.verifier != null ? builder.verifier : new ECDSASignatureVerifier();
        DigestScheme digestScheme = builder.digestScheme != null ? builder.digestScheme
                : new TypedDataDigestScheme(params, address);
        this.validator = new StateUpdateValidator(verifier, digestScheme);
    }

    public static Builder builder(NetworkParameters params, Address address, EscrowLedger ledger) {
        return new Builder(params, address, ledger);
    }

    /**
     * Opens a channel from {@code opener} to {@code counterparty}, escrowing {@code amount} of {@code asset} from the
     * opener.
     *
     * @param challengePeriod seconds that must pass between the start of a challenge and closing
     * @return the id of the new channel
     * @throws ChannelException with {@link ChannelException.Reason#INVALID_PARTY},
     *         {@link ChannelException.Reason#INVALID_CHALLENGE}, {@link ChannelException.Reason#DUPLICATE_CHANNEL}
     *         or {@link ChannelException.Reason#TRANSFER_FAILED}
     * @throws IllegalArgumentException if amount is negative or does not fit 256 bits
     */
    public ChannelId openChannel(final Address opener, final Address counterparty, final Address asset,
                                 final BigInteger amount, final long challengePeriod) throws ChannelException {
        checkNotNull(opener);
        checkNotNull(counterparty);
        checkNotNull(asset);
        Utils.checkUint256(checkNotNull(amount));
        lock.lock();
        try {
            if (opener.isZero() || counterparty.isZero())
                throw new ChannelException(ChannelException.Reason.INVALID_PARTY, "Null identity cannot be a party");
            if (counterparty.equals(opener))
                throw new ChannelException(ChannelException.Reason.INVALID_PARTY,
                        "Cannot open a channel to oneself: " + opener);
            if (challengePeriod <= 0)
                throw new ChannelException(ChannelException.Reason.INVALID_CHALLENGE,
                        "Challenge period must be positive: " + challengePeriod);
            registry.checkNoActiveChannel(opener, counterparty, asset);

            final ChannelId id = ChannelId.derive(opener, counterparty, asset, Utils.currentTimeSeconds());
            EscrowTransaction escrow = new EscrowTransaction(ledger);
            try {
                escrow.transferIn(opener, asset, amount);
            } catch (EscrowTransferException e) {
                throw transferFailed(id, escrow, e);
            }
            registry.register(new Channel(id, opener, counterparty, asset, amount, challengePeriod));
            log.info("Opened channel {} from {} to {} with {} of {}, challenge period {}s", id, opener, counterparty,
                    amount, asset, challengePeriod);
            queueNotification(new Notification() {
                @Override
                public void deliver(ChannelEventListener listener) {
                    listener.onChannelOpen(id, opener, counterparty, asset, amount, challengePeriod);
                }
            });
            return id;
        } catch (ChannelException e) {
            log.info("Refused to open channel from {} to {}: {}", opener, counterparty, e.toString());
            throw e;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Joins an open channel as its counterparty, escrowing {@code amount} of {@code asset} from the caller.
     *
     * @throws ChannelException with {@link ChannelException.Reason#NOT_FOUND},
     *         {@link ChannelException.Reason#UNAUTHORIZED}, {@link ChannelException.Reason#INVALID_STATUS},
     *         {@link ChannelException.Reason#ASSET_MISMATCH} or {@link ChannelException.Reason#TRANSFER_FAILED}
     */
    public void joinChannel(Address caller, final ChannelId id, final Address asset, final BigInteger amount) throws ChannelException {
        checkNotNull(caller);
        checkNotNull(asset);
        Utils.checkUint256(checkNotNull(amount));
        lock.lock();
        try {
            Channel channel = checkTransition(Transition.JOIN, caller, id);
            if (!channel.getAsset().equals(asset))
                throw new ChannelException(ChannelException.Reason.ASSET_MISMATCH,
                        "Channel " + id + " escrows " + channel.getAsset() + ", not " + asset);
            EscrowTransaction escrow = new EscrowTransaction(ledger);
            try {
                escrow.transferIn(caller, asset, amount);
            } catch (EscrowTransferException e) {
                throw transferFailed(id, escrow, e);
            }
            channel.join(amount);
            log.info("{} joined channel {} with {}", caller, id, amount);
            final Address agentA = channel.getAgentA();
            final Address agentB = channel.getAgentB();
            final BigInteger depositA = channel.getDepositA();
            queueNotification(new Notification() {
                @Override
                public void deliver(ChannelEventListener listener) {
                    listener.onChannelJoin(id, agentA, agentB, asset, depositA, amount);
                }
            });
        } catch (ChannelException e) {
            log.info("Refused join of channel {} by {}: {}", id, caller, e.toString());
            throw e;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replaces the recorded balances with a newer state both agents signed. Allowed while the channel is joined or
     * under challenge, so that an agent can answer a challenge started with a stale state.
     *
     * @throws ChannelException with {@link ChannelException.Reason#NOT_FOUND},
     *         {@link ChannelException.Reason#UNAUTHORIZED}, {@link ChannelException.Reason#INVALID_STATUS},
     *         {@link ChannelException.Reason#BALANCE_MISMATCH}, {@link ChannelException.Reason#INVALID_SIGNATURE} or
     *         {@link ChannelException.Reason#NONCE_TOO_LOW}
     */
    public void updateState(Address caller, final ChannelId id, final StateUpdate update) throws ChannelException {
        checkNotNull(caller);
        checkNotNull(update);
        lock.lock();
        try {
            Channel channel = checkTransition(Transition.UPDATE_STATE, caller, id);
            validator.checkBilateral(channel, update);
            if (update.getNonce() <= channel.getNonce())
                throw new ChannelException(ChannelException.Reason.NONCE_TOO_LOW,
                        "Nonce " + update.getNonce() + " is not above " + channel.getNonce() + " for channel " + id);
            channel.applyState(update.getNonce(), update.getBalanceA(), update.getBalanceB());
            log.info("Channel {} moved to nonce {}: A={} B={}", id, update.getNonce(), update.getBalanceA(),
                    update.getBalanceB());
            queueNotification(new Notification() {
                @Override
                public void deliver(ChannelEventListener listener) {
                    listener.onChannelUpdateState(id, update.getNonce(), update.getBalanceA(), update.getBalanceB());
                }
            });
        } catch (ChannelException e) {
            log.info("Refused state update {} on channel {} from {}: {}", update, id, caller, e.toString());
            throw e;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Starts the challenge countdown. Once {@link Channel#getCloseTime()} has passed either agent may close.
     *
     * @return the close time, in seconds since the epoch
     * @throws ChannelException with {@link ChannelException.Reason#NOT_FOUND},
     *         {@link ChannelException.Reason#UNAUTHORIZED} or {@link ChannelException.Reason#INVALID_STATUS}
     */
    public long startChallenge(Address caller, final ChannelId id) throws ChannelException {
        checkNotNull(caller);
        lock.lock();
        try {
            Channel channel = checkTransition(Transition.START_CHALLENGE, caller, id);
            final long closeTime = LongMath.saturatedAdd(Utils.currentTimeSeconds(), channel.getChallengePeriod());
            channel.startChallenge(caller, closeTime);
            log.info("{} started a challenge on channel {}, closable after {}", caller, id, closeTime);
            queueNotification(new Notification() {
                @Override
                public void deliver(ChannelEventListener listener) {
                    listener.onChannelChallenge(id, closeTime);
                }
            });
            return closeTime;
        } catch (ChannelException e) {
            log.info("Refused challenge of channel {} by {}: {}", id, caller, e.toString());
            throw e;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Settles a challenged channel whose challenge period has elapsed: pays balanceA to agentA and balanceB to agentB,
     * then removes the channel. If either payment fails, the other is reversed and the channel stays in challenge so
     * the close can be retried.
     *
     * @throws ChannelException with {@link ChannelException.Reason#NOT_FOUND},
     *         {@link ChannelException.Reason#UNAUTHORIZED}, {@link ChannelException.Reason#INVALID_STATUS},
     *         {@link ChannelException.Reason#CHALLENGE_PERIOD_NOT_ELAPSED} or
     *         {@link ChannelException.Reason#TRANSFER_FAILED}
     */
    public void closeChannel(Address caller, final ChannelId id) throws ChannelException {
        checkNotNull(caller);
        lock.lock();
        try {
            Channel channel = checkTransition(Transition.CLOSE, caller, id);
            long now = Utils.currentTimeSeconds();
            if (now <= channel.getCloseTime())
                throw new ChannelException(ChannelException.Reason.CHALLENGE_PERIOD_NOT_ELAPSED,
                        "Channel " + id + " cannot close before " + channel.getCloseTime() + ", now " + now);
            EscrowTransaction escrow = new EscrowTransaction(ledger);
            try {
                escrow.transferOut(channel.getAgentA(), channel.getAsset(), channel.getBalanceA());
                escrow.transferOut(channel.getAgentB(), channel.getAsset(), channel.getBalanceB());
            } catch (EscrowTransferException e) {
                throw transferFailed(id, escrow, e);
            }
            channel.close();
            registry.remove(id);
            log.info("Closed channel {}: paid {} to {} and {} to {}", id, channel.getBalanceA(), channel.getAgentA(),
                    channel.getBalanceB(), channel.getAgentB());
            queueNotification(new Notification() {
                @Override
                public void deliver(ChannelEventListener listener) {
                    listener.onChannelClose(id);
                }
            });
        } catch (ChannelException e) {
            log.info("Refused close of channel {} by {}: {}", id, caller, e.toString());
            throw e;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns a snapshot of the channel. Later changes to the channel are not reflected in the returned object.
     *
     * @throws ChannelException with {@link ChannelException.Reason#NOT_FOUND} if there is no such channel, including
     *         when it has been closed.
     */
    public Channel getChannel(ChannelId id) throws ChannelException {
        lock.lock();
        try {
            return registry.lookup(id).copy();
        } finally {
            lock.unlock();
        }
    }

    /** Returns the id of the active channel between the two identities over the asset, in either role order. */
    @Nullable
    public ChannelId getActiveChannelId(Address first, Address second, Address asset) {
        lock.lock();
        try {
            return registry.findActiveChannel(first, second, asset);
        } finally {
            lock.unlock();
        }
    }

    /** Returns the number of channels that have been opened and not yet closed. */
    public int getChannelCount() {
        lock.lock();
        try {
            return registry.size();
        } finally {
            lock.unlock();
        }
    }

    public NetworkParameters getParams() {
        return params;
    }

    /** The identity wallets bind their signatures to, as the EIP-712 verifying contract. */
    public Address getAddress() {
        return address;
    }

    /** The digest scheme agents must sign updates under for this manager to accept them. */
    public DigestScheme getDigestScheme() {
        return validator.getDigestScheme();
    }

    /**
     * Adds a listener that is called on the thread performing each operation.
     */
    public void addEventListener(ChannelEventListener listener) {
        addEventListener(listener, Threading.SAME_THREAD);
    }

    /**
     * Adds a listener whose callbacks are handed to the given executor.
     */
    public void addEventListener(ChannelEventListener listener, Executor executor) {
        eventListeners.add(new ListenerRegistration<>(listener, executor));
    }

    /**
     * Removes the given event listener object. Returns true if the listener was removed, false if that listener
     * was never added.
     */
    public boolean removeEventListener(ChannelEventListener listener) {
        return ListenerRegistration.removeFromList(listener, eventListeners);
    }

    /**
     * The single gate every transition of an existing channel passes: the channel must exist, the caller must be
     * allowed to request the transition and the channel must be in a status it starts from.
     */
    @GuardedBy("lock")
    private Channel checkTransition(Transition transition, Address caller, ChannelId id) throws ChannelException {
        Channel channel = registry.lookup(checkNotNull(id));
        boolean authorized = transition.counterpartyOnly ? caller.equals(channel.getAgentB()) : channel.isParty(caller);
        if (!authorized)
            throw new ChannelException(ChannelException.Reason.UNAUTHORIZED,
                    caller + " may not " + transition + " channel " + id);
        if (!transition.from.contains(channel.getStatus()))
            throw new ChannelException(ChannelException.Reason.INVALID_STATUS,
                    "Cannot " + transition + " channel " + id + " while " + channel.getStatus());
        return channel;
    }

    private ChannelException transferFailed(ChannelId id, EscrowTransaction escrow, EscrowTransferException cause) {
        ChannelException failure = new ChannelException(ChannelException.Reason.TRANSFER_FAILED,
                "Escrow transfer for channel " + id + " failed: " + cause.getMessage(), cause);
        try {
            escrow.rollback();
        } catch (EscrowTransferException rollbackFailure) {
            log.error("Channel {}: escrow could not be fully restored", id, rollbackFailure);
            failure.addSuppressed(rollbackFailure);
        }
        return failure;
    }

    private void queueNotification(final Notification notification) {
        for (final ListenerRegistration<ChannelEventListener> registration : eventListeners) {
            try {
                registration.executor.execute(new Runnable() {
                    @Override
                    public void run() {
                        try {
                            notification.deliver(registration.listener);
                        } catch (RuntimeException e) {
                            log.error("Exception in channel event listener", e);
                        }
                    }
                });
            } catch (RejectedExecutionException e) {
                // The operation has already taken effect, only this listener misses the event.
                log.error("Executor rejected channel event for listener {}", registration.listener, e);
            }
        }
    }

    /**
     * Configures a {@link ChannelManager}. The signature verifier defaults to {@link ECDSASignatureVerifier} and the
     * digest scheme to a {@link TypedDataDigestScheme} bound to the network parameters and the manager's address.
     */
    public static class Builder {
        private final NetworkParameters params;
        private final Address address;
        private final EscrowLedger ledger;
        @Nullable private SignatureVerifier verifier;
        @Nullable private DigestScheme digestScheme;

        public Builder(NetworkParameters params, Address address, EscrowLedger ledger) {
            this.params = checkNotNull(params);
            this.address = checkNotNull(address);
            this.ledger = checkNotNull(ledger);
        }

        public Builder signatureVerifier(SignatureVerifier verifier) {
            this.verifier = checkNotNull(verifier);
            return this;
        }

        public Builder digestScheme(DigestScheme digestScheme) {
            this.digestScheme = checkNotNull(digestScheme);
            return this;
        }

        public ChannelManager build() {
            return new ChannelManager(this);
        }
    }
}
