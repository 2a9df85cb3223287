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

package org.statechannelj.params;

import com.google.common.base.MoreObjects;

import javax.annotation.Nullable;

/**
 * <p>NetworkParameters contains the data needed for working with an instantiation of a channel ledger.</p>
 *
 * <p>Signatures on state updates are bound to a signing domain: the domain name and version agreed with off-chain
 * wallets, and the chain id of the ledger the escrow lives on. A signature made for one network can never be replayed
 * on another.</p>
 *
 * <p>This is an abstract class, concrete instantiations can be found in the params package. There are two:
 * one for the main network ({@link MainNetParams}) and one for unit testing ({@link UnitTestParams}).</p>
 */
public abstract class NetworkParameters {

    /** The string returned by getId() for the main, production network. */
    public static final String ID_MAINNET = "org.statechannelj.production";
    /** Unit test network. */
    public static final String ID_UNITTESTNET = "org.statechannelj.unittest";

    /** The EIP-712 domain name wallets are asked to sign under. */
    public static final String DEFAULT_DOMAIN_NAME = "StateChannel";
    /** The EIP-712 domain version wallets are asked to sign under. */
    public static final String DEFAULT_DOMAIN_VERSION = "1";

    protected String id;
    protected long chainId;
    protected String domainName = DEFAULT_DOMAIN_NAME;
    protected String domainVersion = DEFAULT_DOMAIN_VERSION;

    protected NetworkParameters() {
    }

    /**
     * A Java package style string acting as unique ID for these parameters
     */
    public String getId() {
        return id;
    }

    /** The chain id of the ledger holding the escrow. Part of every signing domain. */
    public long getChainId() {
        return chainId;
    }

    public String getDomainName() {
        return domainName;
    }

    public String getDomainVersion() {
        return domainVersion;
    }

    /** Returns the network parameters for the given string ID or NULL if not recognized. */
    @Nullable
    public static NetworkParameters fromID(String id) {
        if (id.equals(ID_MAINNET)) {
            return MainNetParams.get();
        } else if (id.equals(ID_UNITTESTNET)) {
            return UnitTestParams.get();
        } else {
            return null;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return getId().equals(((NetworkParameters) o).getId());
    }

    @Override
    public int hashCode() {
        return getId().hashCode();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", id)
                .add("chainId", chainId)
                .add("domain", domainName + "/" + domainVersion)
                .toString();
    }
}
