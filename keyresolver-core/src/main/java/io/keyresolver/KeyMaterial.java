/*
 * Copyright 2024 Neil Madden.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.keyresolver;

import static java.util.Objects.requireNonNull;

import java.math.BigInteger;
import java.security.MessageDigest;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * The key material of a {@link JsonWebKey}. Exactly one of the following variants is present:
 * <ul>
 *     <li>{@link Secret}: symmetric key bytes ({@code kty=oct}).</li>
 *     <li>{@link Ec}: a P-256, P-384 or P-521 public key, optionally with its private scalar.</li>
 *     <li>{@link Rsa}: an RSA public key, optionally with its private exponent and CRT parameters.</li>
 *     <li>{@link Okp}: an Ed25519 or X25519 public key, optionally with its private key.</li>
 *     <li>{@link Opaque}: a signer whose private key is held elsewhere, such as in an HSM or a KMS.</li>
 * </ul>
 * All variants are immutable. Private components are never included in {@link #toString()}.
 */
public sealed interface KeyMaterial {

    /**
     * The family of this key, used to infer and validate algorithms. Only an opaque signer without a usable public
     * key has no family.
     */
    Optional<KeyFamily> family();

    /**
     * Returns true if this material consists only of public components.
     */
    boolean isPublic();

    /**
     * Returns the public components of this material, or empty for a symmetric key or an opaque signer without a
     * usable public key.
     */
    Optional<KeyMaterial> publicPart();

    /**
     * A short description that is safe to log.
     */
    String describe();

    static Secret secret(byte[] value) {
        return new Secret(value);
    }

    static Ec ecPublic(EcCurve curve, BigInteger x, BigInteger y) {
        return new Ec(curve, x, y, null);
    }

    /**
     * Creates an EC private key, deriving the public point from the private scalar.
     */
    static Ec ecPrivate(EcCurve curve, BigInteger d) {
        var q = curve.publicPoint(d);
        return new Ec(curve, q[0], q[1], d);
    }

    static Rsa rsaPublic(BigInteger n, BigInteger e) {
        return new Rsa(n, e, null, null, null, null, null, null);
    }

    static Okp okpPublic(OkpCurve curve, byte[] x) {
        return new Okp(curve, x, null);
    }

    /**
     * Creates an Ed25519 or X25519 private key, deriving the public key.
     */
    static Okp okpPrivate(OkpCurve curve, byte[] d) {
        return new Okp(curve, curve.derivePublicKey(d), d);
    }

    /**
     * A symmetric secret key.
     *
     * @param value the raw key bytes.
     */
    record Secret(byte[] value) implements KeyMaterial {
        public Secret {
            value = requireNonNull(value, "value").clone();
        }

        @Override
        public byte[] value() {
            return value.clone();
        }

        @Override
        public Optional<KeyFamily> family() {
            return Optional.of(KeyFamily.OCT);
        }

        @Override
        public boolean isPublic() {
            return false;
        }

        @Override
        public Optional<KeyMaterial> publicPart() {
            return Optional.empty();
        }

        @Override
        public String describe() {
            return "oct(" + (value.length * 8) + " bits)";
        }

        @Override
        public boolean equals(Object other) {
            return other instanceof Secret that && MessageDigest.isEqual(this.value, that.value);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(value);
        }

        @Override
        public String toString() {
            return "Secret[" + describe() + "]";
        }
    }

    /**
     * An elliptic curve key on one of the NIST prime curves. The public point is always validated to lie on the
     * curve, and a private scalar must correspond to it.
     *
     * @param curve the curve.
     * @param x the affine x coordinate of the public point.
     * @param y the affine y coordinate of the public point.
     * @param d the private scalar, or null for a public key.
     */
    record Ec(EcCurve curve, BigInteger x, BigInteger y, BigInteger d) implements KeyMaterial {
        public Ec {
            requireNonNull(curve, "curve");
            requireNonNull(x, "x");
            requireNonNull(y, "y");
            curve.validatePoint(x, y);
            if (d != null) {
                var q = curve.publicPoint(d);
                if (!q[0].equals(x) || !q[1].equals(y)) {
                    throw new IllegalArgumentException("EC private key does not match public key");
                }
            }
        }

        @Override
        public Optional<KeyFamily> family() {
            return Optional.of(KeyFamily.of(curve));
        }

        @Override
        public boolean isPublic() {
            return d == null;
        }

        @Override
        public Optional<KeyMaterial> publicPart() {
            return Optional.of(isPublic() ? this : new Ec(curve, x, y, null));
        }

        @Override
        public String describe() {
            return "EC(" + curve.jwkName() + (isPublic() ? ", public)" : ", private)");
        }

        @Override
        public String toString() {
            return "Ec[curve=" + curve.jwkName() + ", x=" + x.toString(16) + ", y=" + y.toString(16)
                    + (isPublic() ? "" : ", d=<redacted>") + "]";
        }
    }

    /**
     * An RSA key. The private exponent {@code d} is present for private keys; the CRT parameters are optional, but
     * either all of them or none of them must be present.
     */
    record Rsa(BigInteger n, BigInteger e, BigInteger d,
               BigInteger p, BigInteger q, BigInteger dp, BigInteger dq, BigInteger qi) implements KeyMaterial {
        public Rsa {
            requireNonNull(n, "n");
            requireNonNull(e, "e");
            if (n.signum() <= 0 || e.signum() <= 0) {
                throw new IllegalArgumentException("RSA modulus and exponent must be positive");
            }
            var crt = Arrays.asList(p, q, dp, dq, qi);
            var present = crt.stream().filter(Objects::nonNull).count();
            if (present != 0 && (present != crt.size() || d == null)) {
                throw new IllegalArgumentException("Incomplete RSA CRT parameters");
            }
            if (p != null && !p.multiply(q).equals(n)) {
                throw new IllegalArgumentException("RSA primes do not match modulus");
            }
        }

        public boolean hasCrtParameters() {
            return p != null;
        }

        @Override
        public Optional<KeyFamily> family() {
            return Optional.of(KeyFamily.RSA);
        }

        @Override
        public boolean isPublic() {
            return d == null;
        }

        @Override
        public Optional<KeyMaterial> publicPart() {
            return Optional.of(isPublic() ? this : rsaPublic(n, e));
        }

        @Override
        public String describe() {
            return "RSA(" + n.bitLength() + (isPublic() ? " bits, public)" : " bits, private)");
        }

        @Override
        public String toString() {
            return "Rsa[n=" + n.toString(16) + ", e=" + e + (isPublic() ? "" : ", d=<redacted>") + "]";
        }
    }

    /**
     * An octet key pair: Ed25519 for signatures or X25519 for key agreement.
     *
     * @param curve the curve.
     * @param x the 32-byte public key.
     * @param d the 32-byte private key, or null for a public key.
     */
    record Okp(OkpCurve curve, byte[] x, byte[] d) implements KeyMaterial {
        public Okp {
            requireNonNull(curve, "curve");
            x = Require.length(x, OkpCurve.KEY_SIZE, curve.jwkName() + " public key must be 32 bytes").clone();
            if (d != null) {
                d = d.clone();
                if (!Arrays.equals(curve.derivePublicKey(d), x)) {
                    throw new IllegalArgumentException(curve.jwkName() + " private key does not match public key");
                }
            }
        }

        @Override
        public byte[] x() {
            return x.clone();
        }

        @Override
        public byte[] d() {
            return d == null ? null : d.clone();
        }

        @Override
        public Optional<KeyFamily> family() {
            return Optional.of(KeyFamily.of(curve));
        }

        @Override
        public boolean isPublic() {
            return d == null;
        }

        @Override
        public Optional<KeyMaterial> publicPart() {
            return Optional.of(isPublic() ? this : new Okp(curve, x, null));
        }

        @Override
        public String describe() {
            return "OKP(" + curve.jwkName() + (isPublic() ? ", public)" : ", private)");
        }

        @Override
        public boolean equals(Object other) {
            return other instanceof Okp that && this.curve == that.curve && Arrays.equals(this.x, that.x)
                    && (this.d == null ? that.d == null : that.d != null && MessageDigest.isEqual(this.d, that.d));
        }

        @Override
        public int hashCode() {
            return Objects.hash(curve, Arrays.hashCode(x), d == null);
        }

        @Override
        public String toString() {
            return "Okp[curve=" + curve.jwkName() + ", x=" + Base64url.encode(x)
                    + (isPublic() ? "" : ", d=<redacted>") + "]";
        }
    }

    /**
     * A key whose private half is not available to this process. Only its public key (if any) is known.
     *
     * @param signer the signer.
     */
    record Opaque(OpaqueSigner signer) implements KeyMaterial {
        public Opaque {
            requireNonNull(signer, "signer");
        }

        @Override
        public Optional<KeyFamily> family() {
            return publicPart().flatMap(KeyMaterial::family);
        }

        @Override
        public boolean isPublic() {
            return false;
        }

        @Override
        public Optional<KeyMaterial> publicPart() {
            return signer.publicKey().flatMap(JcaKeys::fromSupportedPublicKey);
        }

        @Override
        public String describe() {
            return "opaque(" + publicPart().map(KeyMaterial::describe).orElse("unknown") + ")";
        }
    }
}
