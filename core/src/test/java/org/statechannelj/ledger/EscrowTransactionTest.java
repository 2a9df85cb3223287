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
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.math.BigInteger;

import static org.easymock.EasyMock.*;
import static org.junit.Assert.*;

public class EscrowTransactionTest {
    private static final Address ALICE = Address.fromHex("0x00000000000000000000000000000000000000a1");
    private static final Address BOB = Address.fromHex("0x00000000000000000000000000000000000000b0");
    private static final Address TOKEN = Address.fromHex("0x00000000000000000000000000000000000000c0");

    private EscrowLedger ledger;
    private EscrowTransaction tx;

    @Before
    public void setUp() {
        ledger = createStrictMock(EscrowLedger.class);
        tx = new EscrowTransaction(ledger);
    }

    @After
    public void tearDown() {
        verify(ledger);
    }

    @Test
    public void zeroAmountsAreSkipped() throws Exception {
        replay(ledger);
        tx.transferIn(ALICE, TOKEN, BigInteger.ZERO);
        tx.transferOut(BOB, TOKEN, BigInteger.ZERO);
        assertEquals(0, tx.getCompletedTransfers());
        tx.rollback();
    }

    @Test
    public void rollbackReversesNewestFirst() throws Exception {
        ledger.transferOut(ALICE, TOKEN, BigInteger.valueOf(7));
        ledger.transferOut(BOB, TOKEN, BigInteger.valueOf(3));
        ledger.transferIn(BOB, TOKEN, BigInteger.valueOf(3));
        ledger.transferIn(ALICE, TOKEN, BigInteger.valueOf(7));
        replay(ledger);

        tx.transferOut(ALICE, TOKEN, BigInteger.valueOf(7));
        tx.transferOut(BOB, TOKEN, BigInteger.valueOf(3));
        assertEquals(2, tx.getCompletedTransfers());
        tx.rollback();
        assertEquals(0, tx.getCompletedTransfers());
    }

    @Test
    public void failedLegIsNotRecorded() throws Exception {
        ledger.transferIn(ALICE, TOKEN, BigInteger.TEN);
        expectLastCall().andThrow(new EscrowTransferException("no funds"));
        replay(ledger);

        try {
            tx.transferIn(ALICE, TOKEN, BigInteger.TEN);
            fail();
        } catch (EscrowTransferException e) {
            assertEquals("no funds", e.getMessage());
        }
        assertEquals(0, tx.getCompletedTransfers());
        tx.rollback();
    }

    @Test
    public void rollbackAttemptsEveryLeg() throws Exception {
        EscrowTransferException first = new EscrowTransferException("alice frozen");
        EscrowTransferException second = new EscrowTransferException("bob frozen");
        ledger.transferIn(ALICE, TOKEN, BigInteger.ONE);
        ledger.transferIn(BOB, TOKEN, BigInteger.TEN);
        ledger.transferIn(ALICE, TOKEN, BigInteger.valueOf(2));
        ledger.transferOut(ALICE, TOKEN, BigInteger.valueOf(2));
        expectLastCall().andThrow(first);
        ledger.transferOut(BOB, TOKEN, BigInteger.TEN);
        ledger.transferOut(ALICE, TOKEN, BigInteger.ONE);
        expectLastCall().andThrow(second);
        replay(ledger);

        tx.transferIn(ALICE, TOKEN, BigInteger.ONE);
        tx.transferIn(BOB, TOKEN, BigInteger.TEN);
        tx.transferIn(ALICE, TOKEN, BigInteger.valueOf(2));
        try {
            tx.rollback();
            fail();
        } catch (EscrowTransferException e) {
            assertSame(first, e.getCause());
            assertEquals(1, e.getSuppressed().length);
            assertSame(second, e.getSuppressed()[0]);
        }
        assertEquals(0, tx.getCompletedTransfers());
    }

    @Test(expected = IllegalArgumentException.class)
    public void negativeAmount() throws Exception {
        replay(ledger);
        tx.transferOut(BOB, TOKEN, BigInteger.valueOf(-1));
    }
}
