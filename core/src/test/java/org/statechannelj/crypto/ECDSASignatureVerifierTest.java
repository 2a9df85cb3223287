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

import org.statechannelj.core.Address;
import org.statechannelj.core.Keccak256Hash;
import org.statechannelj.core.Utils;
import org.junit.Test;

import java.math.BigInteger;
import java.util.Arrays;

import static org.statechannelj.crypto.TestKeys.*;
import static org.junit.Assert.*;

public class ECDSASignatureVerifierTest {
    private final ECDSASignatureVerifier verifier = new ECDSASignatureVerifier();
    private final Keccak256Hash digest = Keccak256Hash.wrap(TYPED_DIGEST);

    @Test
    public void acceptsSignatureFromClaimedSigner() {
        assertTrue(verifier.verify(digest, Utils.HEX.decode(TYPED_SIG_A), ADDRESS_A));
        assertTrue(verifier.verify(digest, Utils.HEX.decode(TYPED_SIG_B), ADDRESS_B));
        assertEquals(ADDRESS_A, verifier.recoverSigner(digest, Utils.HEX.decode(TYPED_SIG_A)));
    }

    @Test
    public void acceptsBareRecoveryId() {
        byte[] sig = Utils.HEX.decode(TYPED_SIG_A);
        sig[64] -= 27;
        assertTrue(verifier.verify(digest, sig, ADDRESS_A));
    }

    @Test
    public void rejectsWrongSigner() {
        assertFalse(verifier.verify(digest, Utils.HEX.decode(TYPED_SIG_A), ADDRESS_B));
        assertFalse(verifier.verify(Keccak256Hash.ofString("other"), Utils.HEX.decode(TYPED_SIG_A), ADDRESS_A));
    }

    @Test
    public void rejectsZeroSigner() {
        assertFalse(verifier.verify(digest, Utils.HEX.decode(TYPED_SIG_A), Address.ZERO));
    }

    @Test
    public void rejectsHighS() {
        ECKey.ECDSASignature sig = KEY_A.sign(digest);
        // (r, n - s) with the flipped recovery id recovers the same key but is the malleated twin.
        ECKey.ECDSASignature twin = new ECKey.ECDSASignature(sig.r, ECKey.CURVE.getN().subtract(sig.s),
                sig.recId ^ 1);
        assertFalse(twin.isCanonical());
        assertEquals(ADDRESS_A, ECKey.recoverFromSignature(twin.recId, twin, digest).getAddress());
        assertFalse(verifier.verify(digest, twin.encode(), ADDRESS_A));
        assertNull(verifier.recoverSigner(digest, twin.encode()));
    }

    @Test
    public void rejectsMalformedSignatures() {
        assertFalse(verifier.verify(digest, new byte[0], ADDRESS_A));
        assertFalse(verifier.verify(digest, new byte[65], ADDRESS_A));
        byte[] truncated = Arrays.copyOf(Utils.HEX.decode(TYPED_SIG_A), 64);
        assertFalse(verifier.verify(digest, truncated, ADDRESS_A));
        byte[] badV = Utils.HEX.decode(TYPED_SIG_A);
        badV[64] = 5;
        assertFalse(verifier.verify(digest, badV, ADDRESS_A));
    }

    @Test
    public void rejectsRThatIsNotOnCurve() {
        // x = 5 has no point on secp256k1 (5^3 + 7 = 132 is not a quadratic residue mod p).
        ECKey.ECDSASignature sig = new ECKey.ECDSASignature(BigInteger.valueOf(5), BigInteger.ONE, 0);
        assertNull(verifier.recoverSigner(digest, sig.encode()));
    }
}
