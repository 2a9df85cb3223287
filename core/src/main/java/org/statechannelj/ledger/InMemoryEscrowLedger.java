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

import com.google.common.collect.HashBasedTable;
import com.google.common.collect.Table;
import net.jcip.annotations.GuardedBy;
import org.statechannelj.core.Address;
import org.statechannelj.utils.Threading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * <p>An {@link EscrowLedger} that keeps per-asset account balances in memory, together with the total each asset has
 * in escrow. Useful for embedding the channel manager in a single process and for testing.</p>
 *
 * <p>Accounts can be frozen. Any transfer to or from a frozen account fails, the way a token contract refuses a
 * blacklisted holder.</p>
 */
public class InMemoryEscrowLedger implements EscrowLedger {
    private static final Logger log = LoggerFactory.getLogger(InMemoryEscrowLedger.class);

    private final ReentrantLock lock = Threading.lock("InMemoryEscrowLedger");

    // asset -> account -> balance
    @GuardedBy("lock") private final Table<Address, Address, BigInteger> balances = HashBasedTable.create();
    @GuardedBy("lock") private final Map<Address, BigInteger> escrowed = new HashMap<>();
    @GuardedBy("lock") private final Set<Address> frozen = new HashSet<>();

    /** Adds freshly issued funds to an account. */
    public void credit(Address account, Address asset, BigInteger amount) {
        checkNotNull(account);
        checkNotNull(asset);
        checkArgument(amount.signum() >= 0, "Negative amount: %s", amount);
        lock.lock();
        try {
            balances.put(asset, account, balanceLocked(account, asset).add(amount));
        } finally {
            lock.unlock();
        }
    }

    public BigInteger getBalance(Address account, Address asset) {
        lock.lock();
        try {
            return balanceLocked(account, asset);
        } finally {
            lock.unlock();
        }
    }

    /** Returns the total amount of the asset currently held in escrow. */
    public BigInteger getEscrowed(Address asset) {
        lock.lock();
        try {
            return escrowedLocked(asset);
        } finally {
            lock.unlock();
        }
    }

    public void freeze(Address account) {
        lock.lock();
        try {
            frozen.add(checkNotNull(account));
        } finally {
            lock.unlock();
        }
    }

    public void unfreeze(Address account) {
        lock.lock();
        try {
            frozen.remove(account);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void transferIn(Address payer, Address asset, BigInteger amount) throws EscrowTransferException {
        checkArgument(amount.signum() >= 0, "Negative amount: %s", amount);
        lock.lock();
        try {
            if (frozen.contains(payer))
                throw new EscrowTransferException("Account " + payer + " is frozen");
            BigInteger balance = balanceLocked(payer, asset);
            if (balance.compareTo(amount) < 0)
                throw new EscrowTransferException("Insufficient funds: " + payer + " holds " + balance + " of " +
                        asset + ", needs " + amount);
            balances.put(asset, payer, balance.subtract(amount));
            escrowed.put(asset, escrowedLocked(asset).add(amount));
            log.debug("Escrowed {} of {} from {}", amount, asset, payer);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void transferOut(Address payee, Address asset, BigInteger amount) throws EscrowTransferException {
        checkArgument(amount.signum() >= 0, "Negative amount: %s", amount);
        lock.lock();
        try {
            if (frozen.contains(payee))
                throw new EscrowTransferException("Account " + payee + " is frozen");
            BigInteger held = escrowedLocked(asset);
            if (held.compareTo(amount) < 0)
                throw new EscrowTransferException("Escrow holds " + held + " of " + asset + ", cannot pay " + amount);
            escrowed.put(asset, held.subtract(amount));
            balances.put(asset, payee, balanceLocked(payee, asset).add(amount));
            log.debug("Released {} of {} to {}", amount, asset, payee);
        } finally {
            lock.unlock();
        }
    }

    @GuardedBy("lock")
    private BigInteger balanceLocked(Address account, Address asset) {
        BigInteger balance = balances.get(asset, account);
        return balance == null ? BigInteger.ZERO : balance;
    }

    @GuardedBy("lock")
    private BigInteger escrowedLocked(Address asset) {
        BigInteger held = escrowed.get(asset);
        return held == null ? BigInteger.ZERO : held;
    }
}
