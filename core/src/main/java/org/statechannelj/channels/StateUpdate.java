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
import org.statechannelj.core.Utils;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A proposed new channel state: the nonce and both balances, together with the signatures the agents made over it
 * off-channel. Signatures are the raw 65 byte {@code r || s || v} encodings produced by wallets.
 */
public class StateUpdate {
    private final long nonce;
    private final BigInteger balanceA;
    private final BigInteger balanceB;
    private final byte[] sigA;
    private final byte[] sigB;

    public StateUpdate(long nonce, BigInteger balanceA, BigInteger balanceB, byte[] sigA, byte[] sigB) {
        checkArgument(nonce >= 0, "Negative nonce: %s", nonce);
        this.nonce = nonce;
        this.balanceA = Utils.checkUint256(checkNotNull(balanceA));
        this.balanceB = Utils.checkUint256(checkNotNull(balanceB));
        this.sigA = checkNotNull(sigA).clone();
        this.sigB = checkNotNull(sigB).clone();
    }

    public long getNonce() {
        return nonce;
    }

    public BigInteger getBalanceA() {
        return balanceA;
    }

    public BigInteger getBalanceB() {
        return balanceB;
    }

    public byte[] getSigA() {
        return sigA.clone();
    }

    public byte[] getSigB() {
        return sigB.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StateUpdate other = (StateUpdate) o;
        return nonce == other.nonce && balanceA.equals(other.balanceA) && balanceB.equals(other.balanceB)
                && Arrays.equals(sigA, other.sigA) && Arrays.equals(sigB, other.sigB);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nonce, balanceA, balanceB, Arrays.hashCode(sigA), Arrays.hashCode(sigB));
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("nonce", nonce)
                .add("balanceA", balanceA)
                .add("balanceB", balanceB)
                .toString();
    }
}
