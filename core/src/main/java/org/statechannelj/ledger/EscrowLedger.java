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

import java.math.BigInteger;

/**
 * The value-custody primitive that holds channel deposits until settlement. Each call either moves the full amount or
 * fails and moves nothing.
 */
public interface EscrowLedger {
    /**
     * Moves {@code amount} of {@code asset} from the payer's account into escrow.
     *
     * @throws EscrowTransferException if the payer cannot fund the transfer or the ledger refuses it.
     */
    void transferIn(Address payer, Address asset, BigInteger amount) throws EscrowTransferException;

    /**
     * Moves {@code amount} of {@code asset} out of escrow to the payee's account.
     *
     * @throws EscrowTransferException if escrow does not hold enough or the ledger refuses the payee.
     */
    void transferOut(Address payee, Address asset, BigInteger amount) throws EscrowTransferException;
}
