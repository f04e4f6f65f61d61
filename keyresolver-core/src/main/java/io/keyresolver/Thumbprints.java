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

import static java.nio.charset.StandardCharsets.UTF_8;

import java.math.BigInteger;

/**
 * JWK thumbprints as defined by RFC 7638 (and RFC 8037 for OKP keys). Only the required public members are hashed,
 * in lexicographic order and without whitespace, so the private and public forms of a key share a thumbprint.
 */
public final class Thumbprints {

    /**
     * Computes the thumbprint of the given key material.
     *
     * @param material the key material.
     * @param digestAlgorithm the JCA name of the hash function, such as "SHA-256".
     * @return the raw digest.
     * @throws IllegalArgumentException if the material is an opaque signer without a usable public key.
     */
    public static byte[] compute(KeyMaterial material, String digestAlgorithm) {
        return JwkCodec.digest(digestAlgorithm, canonicalJson(material).getBytes(UTF_8));
    }

    /**
     * Computes the default key ID of the given key material: the unpadded base64url encoding of its SHA-256
     * thumbprint.
     */
    public static String keyId(KeyMaterial material) {
        return Base64url.encode(compute(material, "SHA-256"));
    }

    static String canonicalJson(KeyMaterial material) {
        if (material instanceof KeyMaterial.Opaque opaque) {
            material = opaque.publicPart().orElseThrow(
                    () -> new IllegalArgumentException("Opaque signer has no usable public key"));
        }
        var json = new StringBuilder("{");
        if (material instanceof KeyMaterial.Secret secret) {
            member(json, "k", Base64url.encode(secret.value()));
            member(json, "kty", "oct");
        } else if (material instanceof KeyMaterial.Ec ec) {
            int length = ec.curve().coordinateLength();
            member(json, "crv", ec.curve().jwkName());
            member(json, "kty", "EC");
            member(json, "x", Base64url.encode(Utils.toUnsignedBigEndian(ec.x(), length)));
            member(json, "y", Base64url.encode(Utils.toUnsignedBigEndian(ec.y(), length)));
        } else if (material instanceof KeyMaterial.Rsa rsa) {
            member(json, "e", encode(rsa.e()));
            member(json, "kty", "RSA");
            member(json, "n", encode(rsa.n()));
        } else if (material instanceof KeyMaterial.Okp okp) {
            member(json, "crv", okp.curve().jwkName());
            member(json, "kty", "OKP");
            member(json, "x", Base64url.encode(okp.x()));
        }
        json.setLength(json.length() - 1);
        return json.append('}').toString();
    }

    // Values are base64url or fixed names, so no JSON escaping is needed.
    private static void member(StringBuilder json, String name, String value) {
        json.append('"').append(name).append("\":\"").append(value).append("\",");
    }

    private static String encode(BigInteger value) {
        return Base64url.encode(Utils.toUnsignedBigEndian(value));
    }

    private Thumbprints() {}
}
