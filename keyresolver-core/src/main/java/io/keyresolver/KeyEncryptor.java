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
import static java.util.Objects.requireNonNull;

import com.nimbusds.jose.EncryptionMethod;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWEAlgorithm;
import com.nimbusds.jose.JWEHeader;
import com.nimbusds.jose.JWEObject;
import com.nimbusds.jose.Payload;
import com.nimbusds.jose.crypto.PasswordBasedEncrypter;

/**
 * Encrypts keys and other data under a password, producing a JWE that {@link KeyResolver} can read back. Uses
 * PBES2-HS256+A128KW key management with A256GCM content encryption and a random 16-byte salt.
 */
public final class KeyEncryptor {
    private static final RedactedLogger logger = RedactedLogger.getLogger(KeyEncryptor.class);

    public static final int DEFAULT_ITERATIONS = 600_000;
    static final int SALT_LENGTH = 16;
    static final String JWK_CONTENT_TYPE = "jwk+json";
    static final String JWK_SET_CONTENT_TYPE = "jwk-set+json";

    private final int iterations;

    public KeyEncryptor() {
        this(DEFAULT_ITERATIONS);
    }

    /**
     * Creates an encryptor that uses the given PBKDF2 iteration count.
     *
     * @param iterations the iteration count, between 1000 and {@value JweDecryptor#MAX_ITERATIONS}.
     */
    public KeyEncryptor(int iterations) {
        if (iterations < 1000 || iterations > JweDecryptor.MAX_ITERATIONS) {
            throw new IllegalArgumentException("iterations must be between 1000 and " + JweDecryptor.MAX_ITERATIONS);
        }
        this.iterations = iterations;
    }

    /**
     * Encrypts a key, including any private members.
     *
     * @param key the key to encrypt.
     * @param password the password.
     * @return the compact serialized JWE.
     */
    public String encrypt(JsonWebKey key, byte[] password) {
        return encrypt(JwkCodec.toJson(key).getBytes(UTF_8), JWK_CONTENT_TYPE, password);
    }

    /**
     * Encrypts a key set.
     */
    public String encrypt(JsonWebKeySet keySet, byte[] password) {
        return encrypt(JwkCodec.toJson(keySet).getBytes(UTF_8), JWK_SET_CONTENT_TYPE, password);
    }

    /**
     * Encrypts arbitrary data.
     *
     * @param data the plaintext.
     * @param contentType the {@code cty} header value, or null to omit it.
     * @param password the password, which must not be empty.
     * @return the compact serialized JWE.
     */
    public String encrypt(byte[] data, String contentType, byte[] password) {
        requireNonNull(data, "data");
        if (requireNonNull(password, "password").length == 0) {
            throw new IllegalArgumentException("password must not be empty");
        }
        var header = new JWEHeader.Builder(JWEAlgorithm.PBES2_HS256_A128KW, EncryptionMethod.A256GCM)
                .contentType(contentType)
                .build();
        var jwe = new JWEObject(header, new Payload(data));
        try {
            jwe.encrypt(new PasswordBasedEncrypter(password, SALT_LENGTH, iterations));
        } catch (JOSEException e) {
            throw new IllegalStateException("Unable to encrypt", e);
        }
        logger.debug("Encrypted {} bytes with {} PBKDF2 iterations", data.length, iterations);
        return jwe.serialize();
    }
}
