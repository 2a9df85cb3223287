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

package org.statechannelj.ledger;

import org.statechannelj.core.Address;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.Deque;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * <p>Groups several ledger transfers made by one channel operation so that they take effect together or not at all.
 * Every completed transfer is remembered; {@link #rollback()} reverses them newest first with the opposite ledger call
 * (a transfer in is undone by a transfer out to the same party and vice versa).</p>
 *
 * <p>Zero amounts are not sent to the ledger at all, so a party the ledger refuses cannot block a settlement in which it
 * is owed nothing.</p>
 *
 * <p>Instances are single use and not thread safe; the channel manager's lock serializes them.</p>
 */
public class EscrowTransaction {
    private static final Logger log = LoggerFactory.getLogger(EscrowTransaction.class);

    private enum Direction { IN, OUT }

    private static class Leg {
        final Direction direction;
        final Address party;
        final Address asset;
        final BigInteger amount;

        Leg(Direction direction, Address party, Address asset, BigInteger amount) {
            this.direction = direction;
            this.party = party;
            this.asset = asset;
            this.amount = amount;
        }

        @Override
        public String toString() {
            return direction + " " + amount + " of " + asset + (direction == Direction.IN ? " from " : " to ") + party;
        }
    }

    private final EscrowLedger ledger;
    private final Deque<Leg> completed = new ArrayDeque<>();

    public EscrowTransaction(EscrowLedger ledger) {
        this.ledger = checkNotNull(ledger);
    }

    public void transferIn(Address payer, Address asset, BigInteger amount) throws EscrowTransferException {
        checkArgument(amount.signum() >= 0, "Negative amount: %s", amount);
        if (amount.signum() == 0)
            return;
        ledger.transferIn(payer, asset, amount);
        completed.push(new Leg(Direction.IN, payer, asset, amount));
    }

    public void transferOut(Address payee, Address asset, BigInteger amount) throws EscrowTransferException {
        checkArgument(amount.signum() >= 0, "Negative amount: %s", amount);
        if (amount.signum() == 0)
            return;
        ledger.transferOut(payee, asset, amount);
        completed.push(new Leg(Direction.OUT, payee, asset, amount));
    }

    /** Number of transfers that have gone through and would be reversed by {@link #rollback()}. */
    public int getCompletedTransfers() {
        return completed.size();
    }

    /**
     * Reverses all completed transfers, newest first. Every leg is attempted even if an earlier reversal fails.
     *
     * @throws EscrowTransferException if any reversal failed; further failures are attached as suppressed exceptions.
     */
    public void rollback() throws EscrowTransferException {
        EscrowTransferException failure = null;
        while (!completed.isEmpty()) {
            Leg leg = completed.pop();
            try {
                if (leg.direction == Direction.IN)
                    ledger.transferOut(leg.party, leg.asset, leg.amount);
                else
                    ledger.transferIn(leg.party, leg.asset, leg.amount);
                log.info("Reversed escrow transfer: {}", leg);
            } catch (EscrowTransferException e) {
                log.error("Could not reverse escrow transfer: {}", leg, e);
                if (failure == null)
                    failure = new EscrowTransferException("Failed to reverse " + leg, e);
                else
                    failure.addSuppressed(e);
            }
        }
        if (failure != null)
            throw failure;
    }
}
