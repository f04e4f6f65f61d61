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

import java.io.ByteArrayInputStream;
import java.math.BigInteger;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.cert.CertificateEncodingException;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.grack.nanojson.JsonArray;
import com.grack.nanojson.JsonObject;
import com.grack.nanojson.JsonParser;
import com.grack.nanojson.JsonParserException;
import com.grack.nanojson.JsonWriter;

/**
 * Reads and writes the JSON representation of JSON Web Keys (RFC 7517, RFC 7518 section 6, RFC 8037).
 */
public final class JwkCodec {

    /**
     * Parses a single JWK.
     *
     * @param json the UTF-8 encoded JSON.
     * @param source the name of the source, used in error messages.
     * @return the parsed key, exactly as described by the JSON: nothing is inferred.
     * @throws UnrecognizedKeyFormatException if the data is not a JSON object.
     * @throws KeyValidationException if the object is not a valid JWK.
     */
    public static JsonWebKey parseKey(byte[] json, String source) throws KeyResolutionException {
        return parseKey(parseObject(json, source), source);
    }

    /**
     * Parses a JWK Set. A JSON object without a {@code keys} member is read as an empty set.
     *
     * @param json the UTF-8 encoded JSON.
     * @param source the name of the source, used in error messages.
     * @return the parsed key set.
     * @throws UnrecognizedKeyFormatException if the data is not a JSON object.
     * @throws KeyValidationException if the {@code keys} member or any key in it is invalid.
     */
    public static JsonWebKeySet parseKeySet(byte[] json, String source) throws KeyResolutionException {
        var object = parseObject(json, source);
        if (!object.has("keys")) {
            return JsonWebKeySet.empty();
        }
        var keys = object.getArray("keys");
        if (keys == null) {
            throw new KeyValidationException(source, "invalid JWK Set on " + source + ": keys is not an array");
        }
        var result = new ArrayList<JsonWebKey>(keys.size());
        for (int i = 0; i < keys.size(); ++i) {
            if (!(keys.get(i) instanceof JsonObject key)) {
                throw new KeyValidationException(source, "invalid JWK Set on " + source + ": entry " + i
                        + " is not an object");
            }
            result.add(parseKey(key, source));
        }
        return new JsonWebKeySet(result);
    }

    static JsonObject parseObject(byte[] json, String source) throws UnrecognizedKeyFormatException {
        try {
            return JsonParser.object().from(new String(json, UTF_8));
        } catch (JsonParserException e) {
            throw new UnrecognizedKeyFormatException(source, "error reading " + source + ": unsupported format", e);
        }
    }

    static JsonWebKey parseKey(JsonObject json, String source) throws KeyValidationException {
        try {
            var kty = requiredString(json, "kty");
            var material = switch (kty) {
                case "oct" -> parseSecret(json);
                case "EC" -> parseEc(json);
                case "RSA" -> parseRsa(json);
                case "OKP" -> parseOkp(json);
                default -> throw new IllegalArgumentException("unsupported key type " + kty);
            };
            var builder = JsonWebKey.builder(material)
                    .algorithm(optionalString(json, "alg"))
                    .use(optionalString(json, "use"))
                    .keyId(optionalString(json, "kid"));
            if (json.has("x5t")) {
                builder.certificateThumbprintSha1(Base64url.decode(requiredString(json, "x5t")));
            }
            if (json.has("x5t#S256")) {
                builder.certificateThumbprintSha256(Base64url.decode(requiredString(json, "x5t#S256")));
            }
            if (json.has("x5c")) {
                var certificates = parseCertificates(json.getArray("x5c"));
                checkCertificates(material, certificates, builder.build());
                builder.certificates(certificates);
            }
            return builder.build();
        } catch (IllegalArgumentException | CertificateException e) {
            throw new KeyValidationException(source, "invalid JWK on " + source + ": " + e.getMessage(), e);
        }
    }

    /**
     * Serializes a key as a JWK, including any private members.
     *
     * @throws IllegalArgumentException if the key is an opaque signer, whose private key cannot be exported.
     */
    public static String toJson(JsonWebKey key) {
        return JsonWriter.string(toMap(key));
    }

    /**
     * Serializes a key set as a JWK Set document.
     */
    public static String toJson(JsonWebKeySet keySet) {
        var keys = new ArrayList<Map<String, Object>>(keySet.size());
        for (var key : keySet) {
            keys.add(toMap(key));
        }
        return JsonWriter.string(Map.of("keys", keys));
    }

    static Map<String, Object> toMap(JsonWebKey key) {
        var json = new LinkedHashMap<String, Object>();
        var material = key.material();
        if (material instanceof KeyMaterial.Secret secret) {
            json.put("kty", "oct");
            json.put("k", Base64url.encode(secret.value()));
        } else if (material instanceof KeyMaterial.Ec ec) {
            int length = ec.curve().coordinateLength();
            json.put("kty", "EC");
            json.put("crv", ec.curve().jwkName());
            json.put("x", encode(ec.x(), length));
            json.put("y", encode(ec.y(), length));
            if (!ec.isPublic()) {
                json.put("d", encode(ec.d(), length));
            }
        } else if (material instanceof KeyMaterial.Rsa rsa) {
            json.put("kty", "RSA");
            json.put("n", encode(rsa.n()));
            json.put("e", encode(rsa.e()));
            if (!rsa.isPublic()) {
                json.put("d", encode(rsa.d()));
            }
            if (rsa.hasCrtParameters()) {
                json.put("p", encode(rsa.p()));
                json.put("q", encode(rsa.q()));
                json.put("dp", encode(rsa.dp()));
                json.put("dq", encode(rsa.dq()));
                json.put("qi", encode(rsa.qi()));
            }
        } else if (material instanceof KeyMaterial.Okp okp) {
            json.put("kty", "OKP");
            json.put("crv", okp.curve().jwkName());
            json.put("x", Base64url.encode(okp.x()));
            if (!okp.isPublic()) {
                json.put("d", Base64url.encode(okp.d()));
            }
        } else {
            throw new IllegalArgumentException("Cannot serialize " + material.describe());
        }
        putIfNotEmpty(json, "use", key.use());
        putIfNotEmpty(json, "kid", key.keyId());
        putIfNotEmpty(json, "alg", key.algorithm());
        if (!key.certificates().isEmpty()) {
            var chain = new ArrayList<String>();
            for (var certificate : key.certificates()) {
                try {
                    chain.add(Base64.getEncoder().encodeToString(certificate.getEncoded()));
                } catch (CertificateEncodingException e) {
                    throw new IllegalArgumentException("Unable to encode certificate", e);
                }
            }
            json.put("x5c", chain);
        }
        if (key.certificateThumbprintSha1().length > 0) {
            json.put("x5t", Base64url.encode(key.certificateThumbprintSha1()));
        }
        if (key.certificateThumbprintSha256().length > 0) {
            json.put("x5t#S256", Base64url.encode(key.certificateThumbprintSha256()));
        }
        return json;
    }

    private static KeyMaterial parseSecret(JsonObject json) {
        var k = Base64url.decode(requiredString(json, "k"));
        if (k.length == 0) {
            throw new IllegalArgumentException("empty oct key");
        }
        try {
            return KeyMaterial.secret(k);
        } finally {
            Utils.wipe(k);
        }
    }

    private static KeyMaterial parseEc(JsonObject json) {
        var crv = requiredString(json, "crv");
        var curve = EcCurve.forJwkName(crv).orElseThrow(() -> new IllegalArgumentException("unsupported curve " + crv));
        var x = coordinate(json, "x", curve);
        var y = coordinate(json, "y", curve);
        var d = json.has("d") ? coordinate(json, "d", curve) : null;
        return new KeyMaterial.Ec(curve, x, y, d);
    }

    private static BigInteger coordinate(JsonObject json, String member, EcCurve curve) {
        var bytes = Base64url.decode(requiredString(json, member));
        if (bytes.length != curve.coordinateLength()) {
            throw new IllegalArgumentException("wrong length for " + member + " on " + curve.jwkName());
        }
        return new BigInteger(1, bytes);
    }

    private static KeyMaterial parseRsa(JsonObject json) {
        return new KeyMaterial.Rsa(
                integer(json, "n", true),
                integer(json, "e", true),
                integer(json, "d", false),
                integer(json, "p", false),
                integer(json, "q", false),
                integer(json, "dp", false),
                integer(json, "dq", false),
                integer(json, "qi", false));
    }

    private static BigInteger integer(JsonObject json, String member, boolean required) {
        if (!required && !json.has(member)) {
            return null;
        }
        var bytes = Base64url.decode(requiredString(json, member));
        if (bytes.length == 0) {
            throw new IllegalArgumentException("empty value for " + member);
        }
        return new BigInteger(1, bytes);
    }

    private static KeyMaterial parseOkp(JsonObject json) {
        var crv = requiredString(json, "crv");
        var curve = OkpCurve.forJwkName(crv).orElseThrow(() -> new IllegalArgumentException("unsupported curve " + crv));
        var x = Base64url.decode(requiredString(json, "x"));
        if (!json.has("d")) {
            return KeyMaterial.okpPublic(curve, x);
        }
        var d = Base64url.decode(requiredString(json, "d"));
        try {
            return new KeyMaterial.Okp(curve, x, d);
        } finally {
            Utils.wipe(d);
        }
    }

    private static List<X509Certificate> parseCertificates(JsonArray x5c) throws CertificateException {
        if (x5c == null || x5c.isEmpty()) {
            throw new IllegalArgumentException("x5c must be a non-empty array");
        }
        var factory = CertificateFactory.getInstance("X.509");
        var certificates = new ArrayList<X509Certificate>(x5c.size());
        for (var element : x5c) {
            if (!(element instanceof String encoded)) {
                throw new IllegalArgumentException("x5c entries must be strings");
            }
            var der = Base64.getDecoder().decode(encoded);
            certificates.add((X509Certificate) factory.generateCertificate(new ByteArrayInputStream(der)));
        }
        return certificates;
    }

    private static void checkCertificates(KeyMaterial material, List<X509Certificate> certificates,
            JsonWebKey declared) throws CertificateEncodingException {
        var leaf = certificates.get(0);
        var leafKey = JcaKeys.fromSupportedPublicKey(leaf.getPublicKey());
        if (leafKey.isEmpty() || !leafKey.equals(material.publicPart())) {
            throw new IllegalArgumentException("x5c leaf certificate does not contain the key");
        }
        var sha1 = declared.certificateThumbprintSha1();
        if (sha1.length > 0 && !MessageDigest.isEqual(sha1, digest("SHA-1", leaf.getEncoded()))) {
            throw new IllegalArgumentException("x5t does not match x5c leaf certificate");
        }
        var sha256 = declared.certificateThumbprintSha256();
        if (sha256.length > 0 && !MessageDigest.isEqual(sha256, digest("SHA-256", leaf.getEncoded()))) {
            throw new IllegalArgumentException("x5t#S256 does not match x5c leaf certificate");
        }
    }

    static byte[] digest(String algorithm, byte[] data) {
        try {
            return MessageDigest.getInstance(algorithm).digest(data);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }

    private static String requiredString(JsonObject json, String member) {
        if (!json.isString(member)) {
            throw new IllegalArgumentException("missing or invalid " + member);
        }
        return json.getString(member);
    }

    private static String optionalString(JsonObject json, String member) {
        return json.has(member) ? requiredString(json, member) : "";
    }

    private static void putIfNotEmpty(Map<String, Object> json, String member, String value) {
        if (!value.isEmpty()) {
            json.put(member, value);
        }
    }

    private static String encode(BigInteger value, int length) {
        return Base64url.encode(Utils.toUnsignedBigEndian(value, length));
    }

    private static String encode(BigInteger value) {
        return Base64url.encode(Utils.toUnsignedBigEndian(value));
    }

    private JwkCodec() {}
}
