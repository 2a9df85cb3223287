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

import com.google.common.base.MoreObjects;
import org.statechannelj.core.Address;
import org.statechannelj.core.Keccak256Hash;
import org.statechannelj.core.Utils;
import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.asn1.x9.X9IntegerConverter;
import org.bouncycastle.crypto.AsymmetricCipherKeyPair;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.crypto.generators.ECKeyPairGenerator;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.crypto.params.ECKeyGenerationParameters;
import org.bouncycastle.crypto.params.ECPrivateKeyParameters;
import org.bouncycastle.crypto.params.ECPublicKeyParameters;
import org.bouncycastle.crypto.signers.ECDSASigner;
import org.bouncycastle.crypto.signers.HMacDSAKCalculator;
import org.bouncycastle.math.ec.ECAlgorithms;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.math.ec.FixedPointCombMultiplier;
import org.bouncycastle.math.ec.FixedPointUtil;

import javax.annotation.Nullable;
import java.math.BigInteger;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * <p>Represents an elliptic curve public and (optionally) private key on secp256k1, usable for creating and
 * recovering the recoverable ECDSA signatures that channel agents put on state updates.</p>
 *
 * <p>An agent's on-ledger identity is its {@link Address}: the last 20 bytes of the Keccak-256 hash of the
 * uncompressed public key, without the 0x04 prefix byte.</p>
 *
 * <p>Signing is deterministic (RFC 6979) and always produces canonical, low-S signatures.</p>
 */
public class ECKey {

    // The parameters of the secp256k1 curve.
    private static final X9ECParameters CURVE_PARAMS = CustomNamedCurves.getByName("secp256k1");

    /** The parameters of the secp256k1 curve that signatures are made on. */
    public static final ECDomainParameters CURVE;

    /**
     * Equal to CURVE.getN().shiftRight(1), used for canonicalising the S value of a signature. If you aren't
     * sure what this is about, you can ignore it.
     */
    public static final BigInteger HALF_CURVE_ORDER;

    private static final SecureRandom secureRandom;

    static {
        // Tell Bouncy Castle to precompute data that's needed during secp256k1 calculations.
        FixedPointUtil.precompute(CURVE_PARAMS.getG());
        CURVE = new ECDomainParameters(CURVE_PARAMS.getCurve(), CURVE_PARAMS.getG(), CURVE_PARAMS.getN(),
                CURVE_PARAMS.getH());
        HALF_CURVE_ORDER = CURVE_PARAMS.getN().shiftRight(1);
        secureRandom = new SecureRandom();
    }

    // The two parts of the key. If "priv" is set, "pub" can always be calculated. If "pub" is set but not "priv", we
    // can only verify signatures not make them.
    @Nullable protected final BigInteger priv;
    protected final ECPoint pub;

    /**
     * Generates an entirely new keypair. Point compression is irrelevant here, addresses are always derived from the
     * uncompressed encoding.
     */
    public ECKey() {
        ECKeyPairGenerator generator = new ECKeyPairGenerator();
        ECKeyGenerationParameters keygenParams = new ECKeyGenerationParameters(CURVE, secureRandom);
        generator.init(keygenParams);
        AsymmetricCipherKeyPair keypair = generator.generateKeyPair();
        ECPrivateKeyParameters privParams = (ECPrivateKeyParameters) keypair.getPrivate();
        ECPublicKeyParameters pubParams = (ECPublicKeyParameters) keypair.getPublic();
        priv = privParams.getD();
        pub = pubParams.getQ().normalize();
    }

    protected ECKey(@Nullable BigInteger priv, ECPoint pub) {
        if (priv != null) {
            checkArgument(priv.bitLength() <= 32 * 8, "private key exceeds 32 bytes: %s bits", priv.bitLength());
            // Try and catch buggy callers or bad key imports, etc. Zero and one are special because these are often
            // used as sentinel values and because scripting languages have a habit of auto-casting true and false to
            // 1 and 0 or vice-versa. Type confusion bugs could therefore result in private keys with these values.
            checkArgument(!priv.equals(BigInteger.ZERO));
            checkArgument(!priv.equals(BigInteger.ONE));
        }
        this.priv = priv;
        this.pub = checkNotNull(pub).normalize();
    }

    /**
     * Creates an ECKey given the private key only. The public key is calculated from it (this is slow).
     */
    public static ECKey fromPrivate(BigInteger privKey) {
        return new ECKey(privKey, publicPointFromPrivate(privKey));
    }

    /**
     * Creates an ECKey given the private key only, as a 32 byte big endian array.
     */
    public static ECKey fromPrivate(byte[] privKeyBytes) {
        return fromPrivate(new BigInteger(1, privKeyBytes));
    }

    public static ECKey fromPrivateHex(String hex) {
        return fromPrivate(Utils.parseHex(hex));
    }

    /**
     * Creates an ECKey that cannot be used for signing, only verifying signatures, from the given point.
     */
    public static ECKey fromPublicOnly(ECPoint pub) {
        return new ECKey(null, pub);
    }

    /**
     * Creates an ECKey that cannot be used for signing, only verifying signatures, from the given encoded point.
     */
    public static ECKey fromPublicOnly(byte[] pub) {
        return new ECKey(null, CURVE.getCurve().decodePoint(pub));
    }

    /**
     * Returns public key point from the given private key. To convert a byte array into a BigInteger,
     * use {@code new BigInteger(1, bytes);}
     */
    public static ECPoint publicPointFromPrivate(BigInteger privKey) {
        // FixedPointCombMultiplier needs a scalar no longer than the group order.
        if (privKey.bitLength() > CURVE.getN().bitLength()) {
            privKey = privKey.mod(CURVE.getN());
        }
        return new FixedPointCombMultiplier().multiply(CURVE.getG(), privKey);
    }

    /** Returns true if this key has a private part and can therefore sign. */
    public boolean hasPrivKey() {
        return priv != null;
    }

    /** Gets the uncompressed public key, including the 0x04 prefix byte. */
    public byte[] getPubKey() {
        return pub.getEncoded(false);
    }

    public ECPoint getPubKeyPoint() {
        return pub;
    }

    /** Returns the ledger identity controlled by this key. */
    public Address getAddress() {
        byte[] encoded = pub.getEncoded(false);
        return Address.fromHash(Keccak256Hash.of(Arrays.copyOfRange(encoded, 1, encoded.length)));
    }

    /**
     * Signs the given 32 byte digest. The digest must already carry whatever domain wrapping the verifier expects,
     * see {@link DigestScheme}.
     *
     * @throws IllegalStateException if this key has no private part.
     */
    public ECDSASignature sign(Keccak256Hash digest) {
        checkState(priv != null, "Missing private key");
        ECDSASigner signer = new ECDSASigner(new HMacDSAKCalculator(new SHA256Digest()));
        signer.init(true, new ECPrivateKeyParameters(priv, CURVE));
        BigInteger[] components = signer.generateSignature(digest.getBytes());
        ECDSASignature canonical = new ECDSASignature(components[0], components[1], 0).toCanonicalised();
        // Find the recovery id that gives back our own key.
        for (int recId = 0; recId < 2; recId++) {
            ECKey candidate = recoverFromSignature(recId, canonical, digest);
            if (candidate != null && candidate.pub.equals(pub))
                return new ECDSASignature(canonical.r, canonical.s, recId);
        }
        throw new IllegalStateException("Could not construct a recoverable key. This should never happen.");
    }

    /**
     * <p>Given the components of a signature and a selector value, recover and return the public key
     * that generated the signature according to the algorithm in SEC1v2 section 4.1.6.</p>
     *
     * <p>The recId is an index from 0 to 3 which indicates which of the 4 possible keys is the correct one. Because
     * the key recovery operation yields multiple potential keys, the correct key must either be stored alongside the
     * signature, or you must be willing to try each recId in turn until you find one that outputs the key you are
     * expecting.</p>
     *
     * @param recId Which possible key to recover.
     * @param sig the R and S components of the signature, wrapped.
     * @param message Hash of the data that was signed.
     * @return An ECKey containing only the public part, or null if recovery wasn't possible.
     * @throws IllegalArgumentException if R is not the x coordinate of a curve point.
     */
    @Nullable
    public static ECKey recoverFromSignature(int recId, ECDSASignature sig, Keccak256Hash message) {
        checkArgument(recId >= 0, "recId must be positive");
        checkArgument(sig.r.signum() >= 0, "r must be positive");
        checkArgument(sig.s.signum() >= 0, "s must be positive");
        checkNotNull(message);
        // 1.0 For j from 0 to h   (h == recId here and the loop is outside this function)
        //   1.1 Let x = r + jn
        BigInteger n = CURVE.getN();  // Curve order.
        BigInteger i = BigInteger.valueOf((long) recId / 2);
        BigInteger x = sig.r.add(i.multiply(n));
        //   1.2. Convert the integer x to an octet string X of length mlen using the conversion routine
        //        specified in Section 2.3.7, where mlen = ⌈(log2 p)/8⌉ or mlen = ⌈m/8⌉.
        //   1.3. Convert the octet string (16 set binary digits)||X to an elliptic curve point R using the
        //        conversion routine specified in Section 2.3.4. If this conversion routine outputs "invalid", then
        //        do another iteration of Step 1.
        BigInteger prime = CURVE.getCurve().getField().getCharacteristic();
        if (x.compareTo(prime) >= 0) {
            // Cannot have point co-ordinates larger than this as everything takes place modulo Q.
            return null;
        }
        // Compressed keys require you to know an extra bit of data about the y-coord as there are two possibilities.
        // So it's encoded in the recId.
        ECPoint R = decompressKey(x, (recId & 1) == 1);
        //   1.4. If nR != point at infinity, then do another iteration of Step 1 (callers responsibility).
        if (!R.multiply(n).isInfinity())
            return null;
        //   1.5. Compute e from M using Steps 2 and 3 of ECDSA signature verification.
        BigInteger e = message.toBigInteger();
        //   1.6. For k from 1 to 2 do the following.   (loop is outside this function via iterating recId)
        //   1.6.1. Compute a candidate public key as:
        //               Q = mi(r) * (sR - eG)
        //
        //        Where mi(x) is the modular multiplicative inverse. We transform this into the following:
        //               Q = (mi(r) * s ** R) + (mi(r) * -e ** G)
        //        Where -e is the modular additive inverse of e, that is z such that z + e = 0 (mod n).
        BigInteger eInv = BigInteger.ZERO.subtract(e).mod(n);
        BigInteger rInv = sig.r.modInverse(n);
        BigInteger srInv = rInv.multiply(sig.s).mod(n);
        BigInteger eInvrInv = rInv.multiply(eInv).mod(n);
        ECPoint q = ECAlgorithms.sumOfTwoMultiplies(CURVE.getG(), eInvrInv, R, srInv);
        if (q.isInfinity())
            return null;
        return ECKey.fromPublicOnly(q);
    }

    /** Decompress a compressed public key (x co-ord and low-bit of y-coord). */
    private static ECPoint decompressKey(BigInteger xBN, boolean yBit) {
        X9IntegerConverter x9 = new X9IntegerConverter();
        byte[] compEnc = x9.integerToBytes(xBN, 1 + x9.getByteLength(CURVE.getCurve()));
        compEnc[0] = (byte)(yBit ? 0x03 : 0x02);
        return CURVE.getCurve().decodePoint(compEnc);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || !(o instanceof ECKey)) return false;
        ECKey other = (ECKey) o;
        return Objects.equals(this.priv, other.priv) && Objects.equals(this.pub, other.pub);
    }

    @Override
    public int hashCode() {
        return pub.hashCode();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues()
                .add("address", getAddress())
                .add("isPubKeyOnly", priv == null)
                .toString();
    }

    /**
     * Groups the two components that make up a signature together with the recovery id, and provides the 65 byte
     * {@code r || s || v} encoding that wallets produce.
     */
    public static class ECDSASignature {
        public static final int ENCODED_LENGTH = 65;

        /** The two components of the signature. */
        public final BigInteger r, s;
        /** Recovery id, 0 or 1. */
        public final int recId;

        /**
         * Constructs a signature with the given components. Does NOT automatically canonicalise the signature.
         */
        public ECDSASignature(BigInteger r, BigInteger s, int recId) {
            checkArgument(recId == 0 || recId == 1, "recId must be 0 or 1: %s", recId);
            this.r = checkNotNull(r);
            this.s = checkNotNull(s);
            this.recId = recId;
        }

        /**
         * Returns true if the S component is "low", that means it is below {@link ECKey#HALF_CURVE_ORDER}. See <a
         * href="https://github.com/bitcoin/bips/blob/master/bip-0062.mediawiki#Low_S_values_in_signatures">BIP62</a>.
         */
        public boolean isCanonical() {
            return s.compareTo(HALF_CURVE_ORDER) <= 0;
        }

        /**
         * Will automatically adjust the S component to be less than or equal to half the curve order, if necessary.
         * This is required because for every signature (r,s) the signature (r, -s (mod N)) is a valid signature of
         * the same message. Flipping S also flips the parity of the point the key is recovered from, so the recovery
         * id is flipped along with it.
         */
        public ECDSASignature toCanonicalised() {
            if (!isCanonical()) {
                // The order of the curve is the number of valid points that exist on that curve. If S is in the upper
                // half of the number of valid points, then bring it back to the lower half. Otherwise, imagine that
                //    N = 10
                //    s = 8, so (-8 % 10 == 2) thus both (r, 8) and (r, 2) are valid solutions.
                //    10 - 8 == 2, giving us always the latter solution, which is canonical.
                return new ECDSASignature(r, CURVE.getN().subtract(s), recId ^ 1);
            } else {
                return this;
            }
        }

        /** Returns the wallet encoding {@code r || s || v} with v = 27 + recId. */
        public byte[] encode() {
            byte[] out = new byte[ENCODED_LENGTH];
            System.arraycopy(Utils.bigIntegerToBytes(r, 32), 0, out, 0, 32);
            System.arraycopy(Utils.bigIntegerToBytes(s, 32), 0, out, 32, 32);
            out[64] = (byte) (27 + recId);
            return out;
        }

        /**
         * Decodes a 65 byte {@code r || s || v} signature. Both the 27/28 and the 0/1 conventions for v are accepted.
         *
         * @throws SignatureDecodeException if the bytes are not a well formed signature.
         */
        public static ECDSASignature decode(byte[] bytes) throws SignatureDecodeException {
            if (bytes == null || bytes.length != ENCODED_LENGTH)
                throw new SignatureDecodeException("Signature must be " + ENCODED_LENGTH + " bytes");
            BigInteger r = new BigInteger(1, Arrays.copyOfRange(bytes, 0, 32));
            BigInteger s = new BigInteger(1, Arrays.copyOfRange(bytes, 32, 64));
            int v = bytes[64] & 0xff;
            if (v >= 27)
                v -= 27;
            if (v != 0 && v != 1)
                throw new SignatureDecodeException("Invalid recovery byte: " + (bytes[64] & 0xff));
            BigInteger n = CURVE.getN();
            if (r.signum() == 0 || r.compareTo(n) >= 0 || s.signum() == 0 || s.compareTo(n) >= 0)
                throw new SignatureDecodeException("Signature component out of range");
            return new ECDSASignature(r, s, v);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            ECDSASignature other = (ECDSASignature) o;
            return r.equals(other.r) && s.equals(other.s) && recId == other.recId;
        }

        @Override
        public int hashCode() {
            return Objects.hash(r, s, recId);
        }

        @Override
        public String toString() {
            return "0x" + Utils.HEX.encode(encode());
        }
    }
}
