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

import java.math.BigInteger;

import static org.statechannelj.crypto.TestKeys.*;
import static org.junit.Assert.*;

public class ECKeyTest {

    @Test
    public void addressDerivation() {
        assertEquals(ADDRESS_A, KEY_A.getAddress());
        assertEquals(ADDRESS_B, KEY_B.getAddress());
    }

    @Test
    public void signingIsDeterministicAndCanonical() {
        Keccak256Hash digest = Keccak256Hash.wrap(TYPED_DIGEST);
        ECKey.ECDSASignature sig = KEY_A.sign(digest);
        assertTrue(sig.isCanonical());
        assertEquals(sig, KEY_A.sign(digest));
        assertEquals(TYPED_SIG_A, Utils.HEX.encode(sig.encode()));
        assertEquals(TYPED_SIG_B, Utils.HEX.encode(KEY_B.sign(digest).encode()));
    }

    @Test
    public void recoverFromSignature() {
        Keccak256Hash digest = Keccak256Hash.ofString("recover me");
        ECKey key = new ECKey();
        ECKey.ECDSASignature sig = key.sign(digest);
        ECKey recovered = ECKey.recoverFromSignature(sig.recId, sig, digest);
        assertNotNull(recovered);
        assertEquals(key.getAddress(), recovered.getAddress());
        assertFalse(recovered.hasPrivKey());
        // The other recovery id yields some other key.
        ECKey other = ECKey.recoverFromSignature(sig.recId ^ 1, sig, digest);
        assertTrue(other == null || !other.getAddress().equals(key.getAddress()));
    }

    @Test
    public void canonicalisationFlipsRecoveryId() {
        ECKey.ECDSASignature sig = new ECKey.ECDSASignature(BigInteger.TEN,
                ECKey.HALF_CURVE_ORDER.add(BigInteger.ONE), 0);
        assertFalse(sig.isCanonical());
        ECKey.ECDSASignature canonical = sig.toCanonicalised();
        assertTrue(canonical.isCanonical());
        assertEquals(1, canonical.recId);
        assertEquals(ECKey.CURVE.getN().subtract(sig.s), canonical.s);
    }

    @Test
    public void encodeDecode() throws Exception {
        byte[] encoded = Utils.HEX.decode(TYPED_SIG_A);
        ECKey.ECDSASignature sig = ECKey.ECDSASignature.decode(encoded);
        assertEquals(1, sig.recId);
        assertArrayEquals(encoded, sig.encode());
        // v may also be given as a bare recovery id.
        encoded[64] = 1;
        assertEquals(sig, ECKey.ECDSASignature.decode(encoded));
    }

    @Test(expected = SignatureDecodeException.class)
    public void decodeRejectsShortSignature() throws Exception {
        ECKey.ECDSASignature.decode(new byte[64]);
    }

    @Test(expected = SignatureDecodeException.class)
    public void decodeRejectsBadRecoveryByte() throws Exception {
        byte[] encoded = Utils.HEX.decode(TYPED_SIG_A);
        encoded[64] = 29;
        ECKey.ECDSASignature.decode(encoded);
    }

    @Test(expected = SignatureDecodeException.class)
    public void decodeRejectsZeroComponents() throws Exception {
        byte[] encoded = new byte[65];
        encoded[64] = 27;
        ECKey.ECDSASignature.decode(encoded);
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsSentinelPrivateKey() {
        ECKey.fromPrivate(BigInteger.ONE);
    }

    @Test(expected = IllegalStateException.class)
    public void publicOnlyKeyCannotSign() {
        ECKey.fromPublicOnly(KEY_A.getPubKey()).sign(Keccak256Hash.ofString("x"));
    }

    @Test
    public void publicOnlyKeyHasSameAddress() {
        assertEquals(ADDRESS_A, ECKey.fromPublicOnly(KEY_A.getPubKey()).getAddress());
    }
}
