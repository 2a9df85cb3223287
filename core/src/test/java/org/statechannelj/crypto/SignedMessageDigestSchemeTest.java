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

package org.statechannelj.crypto;

import org.statechannelj.core.Keccak256Hash;
import org.statechannelj.core.Utils;
import org.junit.Test;

import static org.statechannelj.crypto.TestKeys.*;
import static org.junit.Assert.*;

public class SignedMessageDigestSchemeTest {
    private final SignedMessageDigestScheme scheme = new SignedMessageDigestScheme();

    @Test
    public void wrapsFingerprint() {
        Keccak256Hash digest = scheme.digest(CHANNEL_ID, NONCE, BALANCE_A, BALANCE_B);
        assertEquals(SIGNED_MESSAGE_DIGEST, digest.toString());
        assertEquals(SIGNED_MESSAGE_SIG_A, Utils.HEX.encode(KEY_A.sign(digest).encode()));
    }

    @Test
    public void signatureDoesNotCarryOverToTypedData() {
        ECDSASignatureVerifier verifier = new ECDSASignatureVerifier();
        byte[] sig = Utils.HEX.decode(SIGNED_MESSAGE_SIG_A);
        assertTrue(verifier.verify(scheme.digest(CHANNEL_ID, NONCE, BALANCE_A, BALANCE_B), sig, ADDRESS_A));
        assertFalse(verifier.verify(Keccak256Hash.wrap(TYPED_DIGEST), sig, ADDRESS_A));
    }
}
