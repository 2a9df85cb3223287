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
import org.statechannelj.core.Utils;
import org.statechannelj.ledger.EscrowLedger;
import org.statechannelj.ledger.EscrowTransferException;
import org.statechannelj.params.UnitTestParams;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.math.BigInteger;

import static org.statechannelj.crypto.TestKeys.*;
import static org.easymock.EasyMock.*;
import static org.junit.Assert.*;

/**
 * Checks the exact escrow transfers each operation makes, and their reversal, against a strict mock ledger.
 */
public class ChannelManagerSettlementTest {
    private static final BigInteger DEPOSIT_A = ETHER.multiply(BigInteger.TEN);
    private static final BigInteger DEPOSIT_B = ETHER.multiply(BigInteger.valueOf(3));
    private static final long CHALLENGE_PERIOD = 600;

    private EscrowLedger ledger;
    private ChannelManager manager;

    @Before
    public void setUp() {
        Utils.setMockClock(CREATION_TIME);
        ledger = createStrictMock(EscrowLedger.class);
        manager = new ChannelManager(UnitTestParams.get(), VERIFYING_CONTRACT, ledger);
    }

    @After
    public void tearDown() {
        Utils.resetMocking();
        verify(ledger);
    }

    @Test
    public void closeReversesPartialPayout() throws Exception {
        ledger.transferIn(ADDRESS_A, Address.ZERO, DEPOSIT_A);
        ledger.transferIn(ADDRESS_B, Address.ZERO, DEPOSIT_B);
        // First close: B's payout fails, A's is taken back.
        ledger.transferOut(ADDRESS_A, Address.ZERO, BALANCE_A);
        ledger.transferOut(ADDRESS_B, Address.ZERO, BALANCE_B);
        expectLastCall().andThrow(new EscrowTransferException("payee rejected"));
        ledger.transferIn(ADDRESS_A, Address.ZERO, BALANCE_A);
        // Retry.
        ledger.transferOut(ADDRESS_A, Address.ZERO, BALANCE_A);
        ledger.transferOut(ADDRESS_B, Address.ZERO, BALANCE_B);
        replay(ledger);

        ChannelId id = manager.openChannel(ADDRESS_A, ADDRESS_B, Address.ZERO, DEPOSIT_A, CHALLENGE_PERIOD);
        manager.joinChannel(ADDRESS_B, id, Address.ZERO, DEPOSIT_B);
        manager.updateState(ADDRESS_A, id, new StateUpdate(NONCE, BALANCE_A, BALANCE_B,
                Utils.HEX.decode(TYPED_SIG_A), Utils.HEX.decode(TYPED_SIG_B)));
        Utils.setMockClock(manager.startChallenge(ADDRESS_B, id) + 1);

        try {
            manager.closeChannel(ADDRESS_A, id);
            fail();
        } catch (ChannelException e) {
            assertEquals(ChannelException.Reason.TRANSFER_FAILED, e.getReason());
            assertTrue(e.getCause() instanceof EscrowTransferException);
        }
        assertEquals(Channel.Status.CHALLENGE, manager.getChannel(id).getStatus());
        manager.closeChannel(ADDRESS_A, id);
        assertEquals(0, manager.getChannelCount());
    }

    @Test
    public void failedReversalIsReported() throws Exception {
        EscrowTransferException reversalFailure = new EscrowTransferException("escrow drained");
        ledger.transferIn(ADDRESS_A, Address.ZERO, DEPOSIT_A);
        ledger.transferIn(ADDRESS_B, Address.ZERO, DEPOSIT_B);
        ledger.transferOut(ADDRESS_A, Address.ZERO, DEPOSIT_A);
        ledger.transferOut(ADDRESS_B, Address.ZERO, DEPOSIT_B);
        expectLastCall().andThrow(new EscrowTransferException("payee rejected"));
        ledger.transferIn(ADDRESS_A, Address.ZERO, DEPOSIT_A);
        expectLastCall().andThrow(reversalFailure);
        replay(ledger);

        ChannelId id = manager.openChannel(ADDRESS_A, ADDRESS_B, Address.ZERO, DEPOSIT_A, CHALLENGE_PERIOD);
        manager.joinChannel(ADDRESS_B, id, Address.ZERO, DEPOSIT_B);
        Utils.setMockClock(manager.startChallenge(ADDRESS_A, id) + 1);
        try {
            manager.closeChannel(ADDRESS_B, id);
            fail();
        } catch (ChannelException e) {
            assertEquals(ChannelException.Reason.TRANSFER_FAILED, e.getReason());
            assertEquals(1, e.getSuppressed().length);
            assertSame(reversalFailure, e.getSuppressed()[0].getCause());
        }
    }

    @Test
    public void zeroBalancesAreNotPaid() throws Exception {
        ledger.transferIn(ADDRESS_A, Address.ZERO, DEPOSIT_A);
        ledger.transferOut(ADDRESS_A, Address.ZERO, DEPOSIT_A);
        replay(ledger);

        ChannelId id = manager.openChannel(ADDRESS_A, ADDRESS_B, Address.ZERO, DEPOSIT_A, CHALLENGE_PERIOD);
        Utils.setMockClock(manager.startChallenge(ADDRESS_A, id) + 1);
        manager.closeChannel(ADDRESS_B, id);
        assertEquals(0, manager.getChannelCount());
    }

    @Test
    public void refusedOperationsMoveNoFunds() throws Exception {
        ledger.transferIn(ADDRESS_A, Address.ZERO, DEPOSIT_A);
        replay(ledger);

        ChannelId id = manager.openChannel(ADDRESS_A, ADDRESS_B, Address.ZERO, DEPOSIT_A, CHALLENGE_PERIOD);
        try {
            manager.joinChannel(ADDRESS_A, id, Address.ZERO, DEPOSIT_B);
            fail();
        } catch (ChannelException e) {
            assertEquals(ChannelException.Reason.UNAUTHORIZED, e.getReason());
        }
        try {
            manager.openChannel(ADDRESS_B, ADDRESS_A, Address.ZERO, DEPOSIT_B, CHALLENGE_PERIOD);
            fail();
        } catch (ChannelException e) {
            assertEquals(ChannelException.Reason.DUPLICATE_CHANNEL, e.getReason());
        }
        long closeTime = manager.startChallenge(ADDRESS_A, id);
        Utils.setMockClock(closeTime);
        try {
            manager.closeChannel(ADDRESS_A, id);
            fail();
        } catch (ChannelException e) {
            assertEquals(ChannelException.Reason.CHALLENGE_PERIOD_NOT_ELAPSED, e.getReason());
        }
    }
}
