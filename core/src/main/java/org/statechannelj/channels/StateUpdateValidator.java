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

import org.statechannelj.core.Keccak256Hash;
import org.statechannelj.crypto.DigestScheme;
import org.statechannelj.crypto.SignatureVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * <p>Decides whether a signed {@link StateUpdate} may become the canonical state of a channel. An update is admissible
 * when its balances redistribute exactly the total deposit, the channel is joined or under challenge, and every
 * required agent signed the update's digest under the configured {@link DigestScheme}.</p>
 *
 * <p>The nonce is not checked here; freshness is the caller's concern.</p>
 */
public class StateUpdateValidator {
    private static final Logger log = LoggerFactory.getLogger(StateUpdateValidator.class);

    private final SignatureVerifier verifier;
    private final DigestScheme digestScheme;

    public StateUpdateValidator(SignatureVerifier verifier, DigestScheme digestScheme) {
        this.verifier = checkNotNull(verifier);
        this.digestScheme = checkNotNull(digestScheme);
    }

    public DigestScheme getDigestScheme() {
        return digestScheme;
    }

    /**
     * Checks an update that both agents must have signed. This is the only form used for balance changes.
     *
     * @throws ChannelException with {@link ChannelException.Reason#BALANCE_MISMATCH},
     *         {@link ChannelException.Reason#INVALID_STATUS} or {@link ChannelException.Reason#INVALID_SIGNATURE}.
     */
    public void checkBilateral(Channel channel, StateUpdate update) throws ChannelException {
        checkStateUpdate(channel, update, true, true);
    }

    /**
     * Checks an update, requiring each agent's signature independently. Kept general so that one-sided updates, such
     * as deposits topped up by a single agent, can reuse it.
     */
    void checkStateUpdate(Channel channel, StateUpdate update, boolean requireSigA, boolean requireSigB)
            throws ChannelException {
        checkNotNull(channel);
        checkNotNull(update);
        if (!update.getBalanceA().add(update.getBalanceB()).equals(channel.getTotalDeposit()))
            throw new ChannelException(ChannelException.Reason.BALANCE_MISMATCH, String.format(
                    "Balances %s + %s do not match total deposit %s of channel %s", update.getBalanceA(),
                    update.getBalanceB(), channel.getTotalDeposit(), channel.getId()));
        Channel.Status status = channel.getStatus();
        if (status != Channel.Status.JOINED && status != Channel.Status.CHALLENGE)
            throw new ChannelException(ChannelException.Reason.INVALID_STATUS,
                    "Channel " + channel.getId() + " cannot take state updates while " + status);

        Keccak256Hash digest = digestScheme.digest(channel.getId(), update.getNonce(), update.getBalanceA(),
                update.getBalanceB());
        if (requireSigA && !verifier.verify(digest, update.getSigA(), channel.getAgentA()))
            throw new ChannelException(ChannelException.Reason.INVALID_SIGNATURE,
                    "Signature A does not match " + channel.getAgentA() + " over " + digest);
        if (requireSigB && !verifier.verify(digest, update.getSigB(), channel.getAgentB()))
            throw new ChannelException(ChannelException.Reason.INVALID_SIGNATURE,
                    "Signature B does not match " + channel.getAgentB() + " over " + digest);
        log.debug("State update {} for channel {} is valid", update, channel.getId());
    }
}
