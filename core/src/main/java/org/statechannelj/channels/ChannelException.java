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

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Thrown when a channel operation is refused. The requested transition did not happen and the channel is exactly as it
 * was before the call; the caller may retry once whatever caused the {@link Reason} has been resolved.
 */
public class ChannelException extends Exception {

    /** Why an operation was refused. */
    public enum Reason {
        /** The counterparty is the null identity or the opener itself. */
        INVALID_PARTY,
        /** The challenge period is not positive. */
        INVALID_CHALLENGE,
        /** The pair already shares an active channel over the asset, in one role order or the other. */
        DUPLICATE_CHANNEL,
        /** The caller is not allowed to perform this transition on the channel. */
        UNAUTHORIZED,
        /** The channel is not in a status that admits this transition. */
        INVALID_STATUS,
        /** A join named a different asset than the channel was opened with. */
        ASSET_MISMATCH,
        /** The proposed balances do not add up to the total deposit. */
        BALANCE_MISMATCH,
        /** The proposed state is not newer than the one already recorded. */
        NONCE_TOO_LOW,
        /** A required signature does not belong to the agent it should. */
        INVALID_SIGNATURE,
        /** The escrow ledger refused a transfer. */
        TRANSFER_FAILED,
        /** The challenge period has not fully elapsed. */
        CHALLENGE_PERIOD_NOT_ELAPSED,
        /** No such channel, or it has been closed. */
        NOT_FOUND
    }

    private final Reason reason;

    public ChannelException(Reason reason, String message) {
        super(message);
        this.reason = checkNotNull(reason);
    }

    public ChannelException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = checkNotNull(reason);
    }

    public Reason getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return "ChannelException{" + reason + ": " + getMessage() + "}";
    }
}
