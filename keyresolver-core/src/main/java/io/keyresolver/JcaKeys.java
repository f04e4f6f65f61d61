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

import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.security.Key;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.interfaces.ECPrivateKey;
import java.security.interfaces.ECPublicKey;
import java.security.interfaces.EdECPrivateKey;
import java.security.interfaces.EdECPublicKey;
import java.security.interfaces.RSAPrivateCrtKey;
import java.security.interfaces.RSAPublicKey;
import java.security.interfaces.XECPrivateKey;
import java.security.interfaces.XECPublicKey;
import java.security.spec.AlgorithmParameterSpec;
import java.security.spec.ECPoint;
import java.security.spec.ECPrivateKeySpec;
import java.security.spec.ECPublicKeySpec;
import java.security.spec.EdECPoint;
import java.security.spec.EdECPrivateKeySpec;
import java.security.spec.EdECPublicKeySpec;
import java.security.spec.NamedParameterSpec;
import java.security.spec.RSAPrivateCrtKeySpec;
import java.security.spec.RSAPrivateKeySpec;
import java.security.spec.RSAPublicKeySpec;
import java.security.spec.XECPrivateKeySpec;
import java.security.spec.XECPublicKeySpec;
import java.util.Optional;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

/**
 * Conversions between {@link KeyMaterial} and the key types of the Java Cryptography Architecture.
 */
public final class JcaKeys {

    /**
     * Converts a JCA key into key material. Private keys are converted together with their derived public part.
     *
     * @param key a secret, public or private key.
     * @return the equivalent key material.
     * @throws IllegalArgumentException if the key type or curve is not supported, or if the public part of a
     * private key cannot be determined.
     */
    public static KeyMaterial fromKey(Key key) {
        if (key instanceof SecretKey secretKey) {
            var encoded = secretKey.getEncoded();
            if (encoded == null) {
                throw new IllegalArgumentException("Secret key is not extractable");
            }
            try {
                return KeyMaterial.secret(encoded);
            } finally {
                Utils.wipe(encoded);
            }
        } else if (key instanceof PublicKey publicKey) {
            return fromSupportedPublicKey(publicKey)
                    .orElseThrow(() -> new IllegalArgumentException("Unsupported public key: " + key.getAlgorithm()));
        } else if (key instanceof ECPrivateKey ecKey) {
            var curve = EcCurve.forJcaParameters(ecKey.getParams())
                    .orElseThrow(() -> new IllegalArgumentException("Unsupported EC curve"));
            return KeyMaterial.ecPrivate(curve, ecKey.getS());
        } else if (key instanceof RSAPrivateCrtKey rsaKey) {
            return new KeyMaterial.Rsa(rsaKey.getModulus(), rsaKey.getPublicExponent(), rsaKey.getPrivateExponent(),
                    rsaKey.getPrimeP(), rsaKey.getPrimeQ(), rsaKey.getPrimeExponentP(), rsaKey.getPrimeExponentQ(),
                    rsaKey.getCrtCoefficient());
        } else if (key instanceof EdECPrivateKey edKey) {
            requireCurve(edKey.getParams(), NamedParameterSpec.ED25519);
            var seed = edKey.getBytes().orElseThrow(() -> new IllegalArgumentException("Ed25519 key not extractable"));
            return KeyMaterial.okpPrivate(OkpCurve.ED25519, seed);
        } else if (key instanceof XECPrivateKey xKey) {
            requireCurve(xKey.getParams(), NamedParameterSpec.X25519);
            var scalar = xKey.getScalar().orElseThrow(() -> new IllegalArgumentException("X25519 key not extractable"));
            return KeyMaterial.okpPrivate(OkpCurve.X25519, scalar);
        }
        throw new IllegalArgumentException("Unsupported key type: " + key.getAlgorithm());
    }

    /**
     * Converts a key pair into private key material.
     */
    public static KeyMaterial fromKeyPair(KeyPair keyPair) {
        return fromKey(keyPair.getPrivate());
    }

    /**
     * Converts a public key into key material if its type and curve are supported.
     *
     * @param key the public key.
     * @return the key material, or empty if the key is of an unsupported type or on an unsupported curve.
     */
    public static Optional<KeyMaterial> fromSupportedPublicKey(PublicKey key) {
        if (key instanceof ECPublicKey ecKey) {
            return EcCurve.forJcaParameters(ecKey.getParams())
                    .map(curve -> KeyMaterial.ecPublic(curve, ecKey.getW().getAffineX(), ecKey.getW().getAffineY()));
        } else if (key instanceof RSAPublicKey rsaKey) {
            return Optional.of(KeyMaterial.rsaPublic(rsaKey.getModulus(), rsaKey.getPublicExponent()));
        } else if (key instanceof EdECPublicKey edKey && isCurve(edKey.getParams(), NamedParameterSpec.ED25519)) {
            return Optional.of(KeyMaterial.okpPublic(OkpCurve.ED25519, encodeEdPoint(edKey.getPoint())));
        } else if (key instanceof XECPublicKey xKey && isCurve(xKey.getParams(), NamedParameterSpec.X25519)) {
            return Optional.of(KeyMaterial.okpPublic(OkpCurve.X25519,
                    Utils.toUnsignedLittleEndian(xKey.getU(), OkpCurve.KEY_SIZE)));
        }
        return Optional.empty();
    }

    /**
     * Converts the public part of some key material into a JCA public key.
     *
     * @throws IllegalArgumentException if the material has no public part.
     */
    public static PublicKey toPublicKey(KeyMaterial material) {
        var publicPart = material.publicPart()
                .orElseThrow(() -> new IllegalArgumentException("Key has no public part: " + material.describe()));
        try {
            if (publicPart instanceof KeyMaterial.Ec ec) {
                var spec = new ECPublicKeySpec(new ECPoint(ec.x(), ec.y()), ec.curve().jcaParameters());
                return KeyFactory.getInstance("EC").generatePublic(spec);
            } else if (publicPart instanceof KeyMaterial.Rsa rsa) {
                return KeyFactory.getInstance("RSA").generatePublic(new RSAPublicKeySpec(rsa.n(), rsa.e()));
            } else if (publicPart instanceof KeyMaterial.Okp okp && okp.curve() == OkpCurve.ED25519) {
                var spec = new EdECPublicKeySpec(NamedParameterSpec.ED25519, decodeEdPoint(okp.x()));
                return KeyFactory.getInstance("Ed25519").generatePublic(spec);
            } else if (publicPart instanceof KeyMaterial.Okp okp) {
                var spec = new XECPublicKeySpec(NamedParameterSpec.X25519, Utils.fromUnsignedLittleEndian(okp.x()));
                return KeyFactory.getInstance("X25519").generatePublic(spec);
            }
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Unable to construct public key", e);
        }
        throw new IllegalArgumentException("Unsupported key material: " + material.describe());
    }

    /**
     * Converts private key material into a JCA private key.
     *
     * @throws IllegalArgumentException if the material is not an asymmetric private key.
     */
    public static PrivateKey toPrivateKey(KeyMaterial material) {
        try {
            if (material instanceof KeyMaterial.Ec ec && !ec.isPublic()) {
                var spec = new ECPrivateKeySpec(ec.d(), ec.curve().jcaParameters());
                return KeyFactory.getInstance("EC").generatePrivate(spec);
            } else if (material instanceof KeyMaterial.Rsa rsa && !rsa.isPublic()) {
                var spec = rsa.hasCrtParameters()
                        ? new RSAPrivateCrtKeySpec(rsa.n(), rsa.e(), rsa.d(), rsa.p(), rsa.q(), rsa.dp(), rsa.dq(),
                                rsa.qi())
                        : new RSAPrivateKeySpec(rsa.n(), rsa.d());
                return KeyFactory.getInstance("RSA").generatePrivate(spec);
            } else if (material instanceof KeyMaterial.Okp okp && !okp.isPublic()) {
                if (okp.curve() == OkpCurve.ED25519) {
                    var spec = new EdECPrivateKeySpec(NamedParameterSpec.ED25519, okp.d());
                    return KeyFactory.getInstance("Ed25519").generatePrivate(spec);
                }
                var spec = new XECPrivateKeySpec(NamedParameterSpec.X25519, okp.d());
                return KeyFactory.getInstance("X25519").generatePrivate(spec);
            }
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Unable to construct private key", e);
        }
        throw new IllegalArgumentException("Not an asymmetric private key: " + material.describe());
    }

    /**
     * Converts a symmetric key into a JCA secret key for the given JCA algorithm, such as {@code HmacSHA256}.
     */
    public static SecretKey toSecretKey(KeyMaterial.Secret secret, String jcaAlgorithm) {
        var value = secret.value();
        try {
            return new SecretKeySpec(value, jcaAlgorithm);
        } finally {
            Utils.wipe(value);
        }
    }

    // RFC 8032, section 5.1.2: little-endian y with the sign of x in the top bit
    static byte[] encodeEdPoint(EdECPoint point) {
        var encoded = Utils.toUnsignedLittleEndian(point.getY(), OkpCurve.KEY_SIZE);
        if (point.isXOdd()) {
            encoded[OkpCurve.KEY_SIZE - 1] |= (byte) 0x80;
        }
        return encoded;
    }

    static EdECPoint decodeEdPoint(byte[] encoded) {
        var copy = encoded.clone();
        boolean xOdd = (copy[OkpCurve.KEY_SIZE - 1] & 0x80) != 0;
        copy[OkpCurve.KEY_SIZE - 1] &= 0x7F;
        BigInteger y = Utils.fromUnsignedLittleEndian(copy);
        return new EdECPoint(xOdd, y);
    }

    // XECKey exposes its parameters as a plain AlgorithmParameterSpec
    private static boolean isCurve(AlgorithmParameterSpec params, NamedParameterSpec expected) {
        return params instanceof NamedParameterSpec named && expected.getName().equalsIgnoreCase(named.getName());
    }

    private static void requireCurve(AlgorithmParameterSpec params, NamedParameterSpec expected) {
        if (!isCurve(params, expected)) {
            throw new IllegalArgumentException("Unsupported curve, expected " + expected.getName());
        }
    }

    private JcaKeys() {}
}
