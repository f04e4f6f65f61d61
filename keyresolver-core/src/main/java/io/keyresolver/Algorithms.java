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

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * JOSE algorithm identifiers, the defaults inferred for each key family, and the combinations of algorithm and key
 * family that are accepted without {@linkplain ResolveOptions#subtle() subtle} mode.
 */
public final class Algorithms {
    public static final String HS256 = "HS256";
    public static final String HS384 = "HS384";
    public static final String HS512 = "HS512";
    public static final String ES256 = "ES256";
    public static final String ES384 = "ES384";
    public static final String ES512 = "ES512";
    public static final String RS256 = "RS256";
    public static final String EDDSA = "EdDSA";
    public static final String XEDDSA = "XEdDSA";
    public static final String A256GCMKW = "A256GCMKW";
    public static final String ECDH_ES = "ECDH-ES";
    public static final String RSA_OAEP_256 = "RSA-OAEP-256";

    public static final String USE_SIGNATURE = "sig";
    public static final String USE_ENCRYPTION = "enc";

    private static final Set<String> SYMMETRIC = Set.of(
            HS256, HS384, HS512,
            "A128KW", "A192KW", "A256KW",
            "A128GCMKW", "A192GCMKW", A256GCMKW,
            "dir");

    private static final Set<String> ECDH = Set.of(ECDH_ES, "ECDH-ES+A128KW", "ECDH-ES+A192KW", "ECDH-ES+A256KW");

    private static final Set<String> RSA_ALGORITHMS = Set.of(
            RS256, "RS384", "RS512",
            "PS256", "PS384", "PS512",
            "RSA1_5", "RSA-OAEP", RSA_OAEP_256, "RSA-OAEP-384", "RSA-OAEP-512");

    private static final Map<String, String> JCA_SIGNATURE_ALGORITHMS = Map.of(
            RS256, "SHA256withRSA",
            "RS384", "SHA384withRSA",
            "RS512", "SHA512withRSA",
            ES256, "SHA256withECDSAinP1363Format",
            ES384, "SHA384withECDSAinP1363Format",
            ES512, "SHA512withECDSAinP1363Format",
            EDDSA, "Ed25519");

    /**
     * Infers the default algorithm for a key family and intended use.
     *
     * <table>
     *     <caption>Default algorithms</caption>
     *     <tr><th>Family</th><th>{@code use} empty or {@code sig}</th><th>{@code use=enc}</th></tr>
     *     <tr><td>oct</td><td>HS256</td><td>A256GCMKW</td></tr>
     *     <tr><td>EC P-256</td><td>ES256</td><td>ECDH-ES</td></tr>
     *     <tr><td>EC P-384</td><td>ES384</td><td>ECDH-ES</td></tr>
     *     <tr><td>EC P-521</td><td>ES512</td><td>ECDH-ES</td></tr>
     *     <tr><td>RSA</td><td>RS256</td><td>RSA-OAEP-256</td></tr>
     *     <tr><td>Ed25519</td><td>EdDSA</td><td>EdDSA</td></tr>
     *     <tr><td>X25519</td><td>XEdDSA</td><td>XEdDSA</td></tr>
     * </table>
     *
     * @param family the key family.
     * @param use the intended use: {@code sig}, {@code enc} or empty.
     * @return the default algorithm.
     */
    public static String defaultAlgorithm(KeyFamily family, String use) {
        boolean encryption = USE_ENCRYPTION.equals(use);
        return switch (family) {
            case OCT -> encryption ? A256GCMKW : HS256;
            case EC_P256 -> encryption ? ECDH_ES : ES256;
            case EC_P384 -> encryption ? ECDH_ES : ES384;
            case EC_P521 -> encryption ? ECDH_ES : ES512;
            case RSA -> encryption ? RSA_OAEP_256 : RS256;
            case ED25519 -> EDDSA;
            case X25519 -> XEDDSA;
        };
    }

    /**
     * Determines whether an algorithm may be used with keys of the given family.
     */
    public static boolean isSupported(String algorithm, KeyFamily family) {
        return switch (family) {
            case OCT -> SYMMETRIC.contains(algorithm);
            case EC_P256 -> ES256.equals(algorithm) || ECDH.contains(algorithm);
            case EC_P384 -> ES384.equals(algorithm) || ECDH.contains(algorithm);
            case EC_P521 -> ES512.equals(algorithm) || ECDH.contains(algorithm);
            case RSA -> RSA_ALGORITHMS.contains(algorithm);
            case ED25519 -> EDDSA.equals(algorithm) || "Ed25519".equals(algorithm);
            case X25519 -> XEDDSA.equals(algorithm) || ECDH.contains(algorithm);
        };
    }

    /**
     * Returns true if the algorithm is used with symmetric ({@code oct}) keys. Raw bytes are only ever treated as a
     * secret key when such an algorithm is requested explicitly.
     */
    public static boolean isSymmetric(String algorithm) {
        return SYMMETRIC.contains(algorithm);
    }

    static Optional<String> jcaSignatureAlgorithm(String algorithm) {
        return Optional.ofNullable(JCA_SIGNATURE_ALGORITHMS.get(algorithm));
    }

    private Algorithms() {}
}
