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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

/**
 * Verifies recoverable secp256k1 signatures by recovering the signing key and comparing its address with the claimed
 * signer, the same way an {@code ecrecover} based contract does. High-S signatures are refused so that every
 * authorization has exactly one valid encoding.
 */
public class ECDSASignatureVerifier implements SignatureVerifier {
    private static final Logger log = LoggerFactory.getLogger(ECDSASignatureVerifier.class);

    @Override
    public boolean verify(Keccak256Hash digest, byte[] signature, Address claimedSigner) {
        if (claimedSigner.isZero())
            return false;
        Address recovered = recoverSigner(digest, signature);
        return recovered != null && recovered.equals(claimedSigner);
    }

    /**
     * Returns the address that produced the signature, or null if the signature is malformed, not canonical or does
     * not recover to any key.
     */
    @Nullable
    public Address recoverSigner(Keccak256Hash digest, byte[] signature) {
        ECKey.ECDSASignature sig;
        try {
            sig = ECKey.ECDSASignature.decode(signature);
        } catch (SignatureDecodeException e) {
            log.debug("Rejecting undecodable signature: {}", e.getMessage());
            return null;
        }
        if (!sig.isCanonical()) {
            log.debug("Rejecting non-canonical signature {}", sig);
            return null;
        }
        ECKey key;
        try {
            key = ECKey.recoverFromSignature(sig.recId, sig, digest);
        } catch (IllegalArgumentException e) {
            // R is not the x co-ordinate of any point on the curve.
            log.debug("Rejecting signature with invalid R: {}", e.getMessage());
            return null;
        }
        return key == null ? null : key.getAddress();
    }
}
