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

/**
 * Checks that a signature over a digest was produced by the claimed signer. Construction of the digest, including
 * any structured-data wrapping, is the caller's job; see {@link DigestScheme}.
 */
public interface SignatureVerifier {
    /**
     * Returns true only if {@code signature} over {@code digest} was made by the key controlling {@code claimedSigner}.
     * Malformed signatures yield false rather than an exception.
     */
    boolean verify(Keccak256Hash digest, byte[] signature, Address claimedSigner);
}
